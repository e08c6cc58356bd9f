package com.mcpgate.mcp.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Allow-list matching plus failed-attempt lockout for client IPs.
 * <p>
 * {@link #isAllowed(String)} and {@link #isBlocked(String)} are checked at different admission
 * stages: the first applies the configured allow-list (and refuses blocked IPs), the second only
 * answers whether an IP is currently locked out.
 */
public class IpFilter {
    private static final Logger logger = LoggerFactory.getLogger(IpFilter.class);

    private final List<AddressBlock> allowedBlocks;
    private final int maxFailedAttempts;
    private final BanPolicy banPolicy;
    private final Clock clock;

    private final Map<String, Integer> failedAttempts = new HashMap<>();
    private final Map<String, Instant> lastFailedAttempt = new HashMap<>();
    private final Map<String, Instant> blockedIps = new HashMap<>();

    public IpFilter(Collection<String> allowedIps, int maxFailedAttempts, BanPolicy banPolicy) {
        this(allowedIps, maxFailedAttempts, banPolicy, Clock.systemUTC());
    }

    public IpFilter(Collection<String> allowedIps, int maxFailedAttempts, BanPolicy banPolicy, Clock clock) {
        if (maxFailedAttempts <= 0) {
            throw new IllegalArgumentException("maxFailedAttempts must be positive: " + maxFailedAttempts);
        }
        this.maxFailedAttempts = maxFailedAttempts;
        this.banPolicy = Objects.requireNonNull(banPolicy, "banPolicy");
        this.clock = clock;
        this.allowedBlocks = parseAllowList(allowedIps);
    }

    /**
     * @return false if the IP is locked out; otherwise true when no allow-list is configured,
     *         or when the IP matches one of its entries
     */
    public boolean isAllowed(String ip) {
        if (isBlocked(ip)) {
            return false;
        }
        if (allowedBlocks.isEmpty()) {
            return true;
        }

        byte[] address = toAddressBytes(ip);
        if (address == null) {
            return false;
        }
        for (AddressBlock block : allowedBlocks) {
            if (block.contains(address)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Counts a failed authentication, locking the IP out once the threshold is reached.
     *
     * @return true if this attempt caused (or the IP already has) a lockout
     */
    public synchronized boolean recordFailedAttempt(String ip) {
        liftExpiredBan(ip);
        int attempts = failedAttempts.merge(ip, 1, Integer::sum);
        lastFailedAttempt.put(ip, clock.instant());
        if (attempts >= maxFailedAttempts) {
            if (!blockedIps.containsKey(ip)) {
                blockedIps.put(ip, clock.instant());
                logger.warn("IP {} blocked after {} failed authentication attempts", ip, attempts);
            }
            return true;
        }
        return false;
    }

    public synchronized boolean isBlocked(String ip) {
        liftExpiredBan(ip);
        return blockedIps.containsKey(ip);
    }

    public synchronized int getFailedAttempts(String ip) {
        return failedAttempts.getOrDefault(ip, 0);
    }

    /**
     * Lifts expired bans and forgets failure counts of IPs that are not blocked and have not
     * failed within {@code retention}.
     *
     * @return number of IPs whose state was dropped
     */
    public synchronized int pruneStale(Duration retention) {
        Instant now = clock.instant();
        new ArrayList<>(blockedIps.keySet()).forEach(this::liftExpiredBan);

        Instant cutoff = now.minus(retention);
        int removed = 0;
        Iterator<Map.Entry<String, Instant>> iterator = lastFailedAttempt.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, Instant> entry = iterator.next();
            if (!blockedIps.containsKey(entry.getKey()) && entry.getValue().isBefore(cutoff)) {
                failedAttempts.remove(entry.getKey());
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    synchronized int trackedIps() {
        return failedAttempts.size();
    }

    public synchronized Set<String> getBlockedIps() {
        return Set.copyOf(blockedIps.keySet());
    }

    public boolean hasAllowList() {
        return !allowedBlocks.isEmpty();
    }

    private void liftExpiredBan(String ip) {
        Instant bannedAt = blockedIps.get(ip);
        if (bannedAt != null && !banPolicy.isActive(bannedAt, clock.instant())) {
            blockedIps.remove(ip);
            failedAttempts.remove(ip);
            lastFailedAttempt.remove(ip);
            logger.info("Ban lifted for IP {}", ip);
        }
    }

    private static List<AddressBlock> parseAllowList(Collection<String> allowedIps) {
        List<AddressBlock> blocks = new ArrayList<>();
        if (allowedIps == null) {
            return blocks;
        }
        for (String entry : allowedIps) {
            if (entry == null || entry.isBlank()) {
                continue;
            }
            try {
                blocks.add(AddressBlock.parse(entry.trim()));
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping invalid allowed IP entry '{}': {}", entry, e.getMessage());
            }
        }
        return List.copyOf(blocks);
    }

    /**
     * Parses a literal IP address without doing any DNS lookups.
     */
    static byte[] toAddressBytes(String ip) {
        if (ip == null || ip.isBlank() || !looksLikeAddress(ip)) {
            return null;
        }
        try {
            return InetAddress.getByName(ip).getAddress();
        } catch (UnknownHostException e) {
            return null;
        }
    }

    private static boolean looksLikeAddress(String value) {
        if (value.indexOf(':') >= 0) {
            return true;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c != '.' && (c < '0' || c > '9')) {
                return false;
            }
        }
        return true;
    }

    /**
     * An exact address or CIDR network.
     */
    record AddressBlock(byte[] network, int prefixLength) {

        static AddressBlock parse(String entry) {
            String addressPart = entry;
            int prefix = -1;
            int slash = entry.indexOf('/');
            if (slash >= 0) {
                addressPart = entry.substring(0, slash);
                try {
                    prefix = Integer.parseInt(entry.substring(slash + 1));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("invalid prefix length");
                }
            }

            byte[] address = toAddressBytes(addressPart);
            if (address == null) {
                throw new IllegalArgumentException("not an IP address");
            }
            int maxPrefix = address.length * 8;
            if (prefix == -1) {
                prefix = maxPrefix;
            }
            if (prefix < 0 || prefix > maxPrefix) {
                throw new IllegalArgumentException("prefix length out of range");
            }
            return new AddressBlock(address, prefix);
        }

        boolean contains(byte[] address) {
            if (address.length != network.length) {
                return false;
            }
            int fullBytes = prefixLength / 8;
            for (int i = 0; i < fullBytes; i++) {
                if (address[i] != network[i]) {
                    return false;
                }
            }
            int remainingBits = prefixLength % 8;
            if (remainingBits == 0) {
                return true;
            }
            int mask = (0xFF << (8 - remainingBits)) & 0xFF;
            return (address[fullBytes] & mask) == (network[fullBytes] & mask);
        }
    }
}
