package me.bechberger.mcpprobe.model;

import java.util.List;

/**
 * How well the server works with one simulated client.
 *
 * @param compatibilityScore supported features divided by attempted features, 0 when nothing was attempted
 */
public record IntegrationTestResult(
        String clientName,
        boolean connectionSuccessful,
        double handshakeTimeMs,
        List<String> supportedFeatures,
        List<String> failedFeatures,
        double compatibilityScore,
        List<String> errors
) {

    public IntegrationTestResult {
        supportedFeatures = List.copyOf(supportedFeatures);
        failedFeatures = List.copyOf(failedFeatures);
        errors = List.copyOf(errors);
    }

    public static IntegrationTestResult notConnected(String clientName, List<String> errors) {
        return new IntegrationTestResult(clientName, false, 0.0, List.of(), List.of(), 0.0, errors);
    }
}
