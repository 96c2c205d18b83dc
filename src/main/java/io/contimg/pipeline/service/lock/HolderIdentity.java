package io.contimg.pipeline.service.lock;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Optional;
import java.util.UUID;

/**
 * Identifies this process as a lock holder ({@code host:pid:instance}) and answers liveness questions about
 * other holders on the same host.
 */
@Slf4j
@Getter
@Component
public class HolderIdentity {

    private final String host;
    private final long pid;
    private final String holderId;

    public HolderIdentity() {
        this.host = resolveHost();
        this.pid = ProcessHandle.current().pid();
        this.holderId = host + ":" + pid + ":" + UUID.randomUUID().toString().substring(0, 8);
        log.info("Lock holder identity for this process: {}", holderId);
    }

    private static String resolveHost() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Could not resolve local host name, falling back to 'localhost'.", e);
            return "localhost";
        }
    }

    public boolean isSelf(String otherHolderId) {
        return holderId.equals(otherHolderId);
    }

    /**
     * @return true when the holder id names a process on this host, so its liveness can be checked directly
     */
    public boolean isLocal(String otherHolderId) {
        return parse(otherHolderId).map(p -> p.host().equals(host)).orElse(false);
    }

    /**
     * Whether a holder on this host is still running. Holders on other hosts, and ids that cannot be parsed,
     * are reported as alive since their liveness cannot be checked from here.
     */
    public boolean isAlive(String otherHolderId) {
        if (isSelf(otherHolderId)) {
            return true;
        }
        Optional<Parsed> parsed = parse(otherHolderId);
        if (parsed.isEmpty() || !parsed.get().host().equals(host)) {
            return true;
        }
        return ProcessHandle.of(parsed.get().pid()).map(ProcessHandle::isAlive).orElse(false);
    }

    static Optional<Parsed> parse(String holderId) {
        if (holderId == null) {
            return Optional.empty();
        }
        String[] parts = holderId.split(":");
        if (parts.length < 3) {
            return Optional.empty();
        }
        try {
            return Optional.of(new Parsed(parts[0], Long.parseLong(parts[1])));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    record Parsed(String host, long pid) {
    }
}
