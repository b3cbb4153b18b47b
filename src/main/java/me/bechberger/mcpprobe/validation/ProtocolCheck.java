package me.bechberger.mcpprobe.validation;

import me.bechberger.mcpprobe.model.ProtocolComplianceResult;
import me.bechberger.mcpprobe.model.ValidationLevel;
import me.bechberger.mcpprobe.process.ProcessStartException;
import me.bechberger.mcpprobe.process.ServerProcess;
import me.bechberger.mcpprobe.protocol.McpRequests;
import me.bechberger.mcpprobe.protocol.McpSession;
import me.bechberger.mcpprobe.protocol.ProtocolException;
import me.bechberger.mcpprobe.protocol.ServerInfo;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Performs the initialize handshake and compares advertised capabilities with the baseline.
 */
public class ProtocolCheck implements ValidationCheck<ProtocolComplianceResult> {

    @Override
    public @NotNull ValidationPhase getPhase() {
        return ValidationPhase.PROTOCOL;
    }

    @Override
    public @NotNull ProtocolComplianceResult run(@NotNull ValidationContext context) {
        List<String> baseline = context.options().getBaselineCapabilities();
        List<String> errors = new ArrayList<>();

        try (ServerProcess process = context.startServer()) {
            McpSession session = context.openSession(process);
            ServerInfo info;
            try {
                info = session.initialize();
            } catch (IOException e) {
                errors.add("Initialize handshake failed: " + e.getMessage());
                return new ProtocolComplianceResult(false, List.of(), missing(baseline, Set.of()),
                        null, null, null, errors);
            }
            if (info.protocolVersion() == null) {
                errors.add("Server did not report a protocol version");
            }

            Set<String> supported = supportedCapabilities(info);

            if (context.options().getLevel().atLeast(ValidationLevel.STANDARD)) {
                for (String kind : McpRequests.LISTABLE_KINDS) {
                    String method = McpRequests.listMethod(kind);
                    if (supported.contains(method) && baseline.contains(method)) {
                        try {
                            session.listAll(kind);
                        } catch (ProtocolException e) {
                            errors.add("Advertised method " + e.getMessage());
                        }
                    }
                }
            }

            List<String> missing = missing(baseline, supported);
            return new ProtocolComplianceResult(errors.isEmpty() && missing.isEmpty(), List.copyOf(supported), missing,
                    info.protocolVersion(), info.name(), info.version(), errors);
        } catch (ProcessStartException e) {
            errors.add(e.getMessage());
            return new ProtocolComplianceResult(false, List.of(), missing(baseline, Set.of()), null, null, null, errors);
        }
    }

    @Override
    public @NotNull ProtocolComplianceResult failed(@NotNull ValidationContext context, @NotNull String reason) {
        return ProtocolComplianceResult.skipped(reason, context.options().getBaselineCapabilities());
    }

    /**
     * {@code initialize}, then {@code <kind>/list} for listable capabilities and the bare key for the others
     */
    static Set<String> supportedCapabilities(ServerInfo info) {
        Set<String> supported = new LinkedHashSet<>();
        supported.add(McpRequests.INITIALIZE);
        for (String key : info.capabilityKeys()) {
            supported.add(McpRequests.LISTABLE_KINDS.contains(key) ? McpRequests.listMethod(key) : key);
        }
        return supported;
    }

    static List<String> missing(List<String> baseline, Set<String> supported) {
        return baseline.stream().filter(name -> !supported.contains(name)).toList();
    }
}
