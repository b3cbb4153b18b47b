package me.bechberger.mcpprobe.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Outcome of the handshake and capability comparison.
 *
 * @param supportedCapabilities capability names the server advertises, in advertised order
 * @param missingCapabilities   baseline names the server does not advertise, in baseline order
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProtocolComplianceResult(
        boolean success,
        List<String> supportedCapabilities,
        List<String> missingCapabilities,
        @Nullable String protocolVersion,
        @Nullable String serverName,
        @Nullable String serverVersion,
        List<String> errors
) implements PhaseResult {

    public ProtocolComplianceResult {
        supportedCapabilities = List.copyOf(supportedCapabilities);
        missingCapabilities = List.copyOf(missingCapabilities);
        errors = List.copyOf(errors);
    }

    public static ProtocolComplianceResult skipped(String reason, List<String> baseline) {
        return new ProtocolComplianceResult(false, List.of(), baseline, null, null, null, List.of(reason));
    }
}
