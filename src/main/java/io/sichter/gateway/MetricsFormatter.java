package io.sichter.gateway;

import java.util.Map;

final class MetricsFormatter {
    private MetricsFormatter() {
    }

    static String format(Stats stats) {
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "sichter_queue_depth", "Pending jobs in the queue", stats.queueDepth());
        appendGauge(sb, "sichter_queue_in_flight", "Jobs claimed by the worker", stats.inFlight());
        appendGauge(sb, "sichter_events_last_seq", "Sequence number of the newest event", stats.lastSeq());
        appendGauge(sb, "sichter_stream_clients", "Connected event stream clients", stats.streamClients());
        appendCounter(sb, "sichter_stream_dropped_events_total", "Events dropped for slow stream clients", stats.droppedEvents());
        appendCounter(sb, "sichter_write_rate_limited_total", "Write requests rejected by the rate limit", stats.rateLimited());
        appendMapGauge(sb, "sichter_jobs", "Jobs in the ledger grouped by status", "status", stats.jobsByStatus());
        return sb.toString();
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, long value) {
        header(sb, metric, help, "gauge");
        sb.append(metric).append(' ').append(value).append('\n');
    }

    private static void appendCounter(StringBuilder sb, String metric, String help, long value) {
        header(sb, metric, help, "counter");
        sb.append(metric).append(' ').append(value).append('\n');
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Long> values) {
        header(sb, metric, help, "gauge");
        for (Map.Entry<String, Long> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void header(StringBuilder sb, String metric, String help, String type) {
        sb.append("# HELP ").append(metric).append(' ').append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(' ').append(type).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    record Stats(
            long queueDepth,
            long inFlight,
            long lastSeq,
            long streamClients,
            long droppedEvents,
            long rateLimited,
            Map<String, Long> jobsByStatus
    ) {
    }
}
