package io.sichter.collaborator;

public record CollaboratorResult(
        boolean success,
        String output,
        String error
) {
    public static CollaboratorResult ok(String output) {
        return new CollaboratorResult(true, output, null);
    }

    public static CollaboratorResult fail(String error) {
        return new CollaboratorResult(false, null, error);
    }

    public static CollaboratorResult fail(String error, String output) {
        return new CollaboratorResult(false, output, error);
    }
}
