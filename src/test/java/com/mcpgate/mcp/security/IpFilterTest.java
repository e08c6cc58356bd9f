package com.mcpgate.mcp.security;

import com.mcpgate.mcp.TestUtils.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class IpFilterTest {

    @Nested
    class AllowList {

        @Test
        @DisplayName("An empty allow-list admits every address")
        void testEmptyAllowList() {
            IpFilter ipFilter = new IpFilter(Set.of(), 5, BanPolicy.permanent());
            assertFalse(ipFilter.hasAllowList());
            assertTrue(ipFilter.isAllowed("203.0.113.9"));
            assertTrue(ipFilter.isAllowed("::1"));
        }

        @ParameterizedTest
        @CsvSource({
                "192.168.1.0/24, 192.168.1.77, true",
                "192.168.1.0/24, 192.168.2.1, false",
                "10.0.0.0/8, 10.200.3.4, true",
                "172.16.0.0/12, 172.31.255.255, true",
                "172.16.0.0/12, 172.32.0.1, false",
                "127.0.0.1, 127.0.0.1, true",
                "127.0.0.1, 127.0.0.2, false",
                "0.0.0.0/0, 8.8.8.8, true",
                "2001:db8::/32, 2001:db8:1::5, true",
                "2001:db8::/32, 2001:db9::1, false"
        })
        void testMatching(String entry, String ip, boolean expected) {
            IpFilter ipFilter = new IpFilter(List.of(entry), 5, BanPolicy.permanent());
            assertEquals(expected, ipFilter.isAllowed(ip));
        }

        @Test
        void testIpv4DoesNotMatchIpv6Block() {
            IpFilter ipFilter = new IpFilter(List.of("::/0"), 5, BanPolicy.permanent());
            assertFalse(ipFilter.isAllowed("10.0.0.1"));
        }

        @Test
        @DisplayName("Invalid entries are skipped, valid ones still apply")
        void testInvalidEntriesSkipped() {
            IpFilter ipFilter = new IpFilter(List.of("not-an-ip", "10.0.0.0/99", "10.0.0.0/8"), 5, BanPolicy.permanent());
            assertTrue(ipFilter.hasAllowList());
            assertTrue(ipFilter.isAllowed("10.1.1.1"));
            assertFalse(ipFilter.isAllowed("11.1.1.1"));
        }

        @Test
        void testHostnamesAreNotResolved() {
            IpFilter ipFilter = new IpFilter(List.of("127.0.0.1"), 5, BanPolicy.permanent());
            assertFalse(ipFilter.isAllowed("localhost"));
            assertNull(IpFilter.toAddressBytes("example.com"));
        }
    }

    @Nested
    class Lockout {

        @Test
        @DisplayName("The IP is blocked exactly at the failure threshold")
        void testLockoutThreshold() {
            IpFilter ipFilter = new IpFilter(Set.of(), 3, BanPolicy.permanent());
            assertFalse(ipFilter.recordFailedAttempt("10.0.0.5"));
            assertFalse(ipFilter.recordFailedAttempt("10.0.0.5"));
            assertFalse(ipFilter.isBlocked("10.0.0.5"));
            assertTrue(ipFilter.recordFailedAttempt("10.0.0.5"));

            assertTrue(ipFilter.isBlocked("10.0.0.5"));
            assertFalse(ipFilter.isAllowed("10.0.0.5"));
            assertThat(ipFilter.getBlockedIps()).containsExactly("10.0.0.5");
            assertEquals(3, ipFilter.getFailedAttempts("10.0.0.5"));
        }

        @Test
        void testBlockOverridesAllowList() {
            IpFilter ipFilter = new IpFilter(List.of("10.0.0.0/8"), 1, BanPolicy.permanent());
            ipFilter.recordFailedAttempt("10.0.0.5");
            assertFalse(ipFilter.isAllowed("10.0.0.5"));
            assertTrue(ipFilter.isAllowed("10.0.0.6"));
        }

        @Test
        void testPermanentBanNeverLifts() {
            MutableClock clock = new MutableClock();
            IpFilter ipFilter = new IpFilter(Set.of(), 1, BanPolicy.permanent(), clock);
            ipFilter.recordFailedAttempt("10.0.0.5");
            clock.advance(Duration.ofDays(365));
            assertTrue(ipFilter.isBlocked("10.0.0.5"));
        }

        @Test
        @DisplayName("A timed ban lifts after its duration and resets the counter")
        void testTimedBanExpires() {
            MutableClock clock = new MutableClock();
            IpFilter ipFilter = new IpFilter(Set.of(), 2, BanPolicy.ofDuration(Duration.ofMinutes(10)), clock);
            ipFilter.recordFailedAttempt("10.0.0.5");
            ipFilter.recordFailedAttempt("10.0.0.5");
            assertTrue(ipFilter.isBlocked("10.0.0.5"));

            clock.advance(Duration.ofMinutes(9));
            assertTrue(ipFilter.isBlocked("10.0.0.5"));

            clock.advance(Duration.ofMinutes(1));
            assertFalse(ipFilter.isBlocked("10.0.0.5"));
            assertEquals(0, ipFilter.getFailedAttempts("10.0.0.5"));
            assertFalse(ipFilter.recordFailedAttempt("10.0.0.5"));
        }

        @Test
        void testInvalidConstruction() {
            assertThrows(IllegalArgumentException.class, () -> new IpFilter(Set.of(), 0, BanPolicy.permanent()));
            assertThrows(NullPointerException.class, () -> new IpFilter(Set.of(), 1, null));
            assertThrows(IllegalArgumentException.class, () -> BanPolicy.ofDuration(Duration.ZERO));
        }
    }

    @Nested
    class Pruning {

        @Test
        @DisplayName("Failure counts below the threshold are forgotten after the retention period")
        void testPruneStaleFailures() {
            MutableClock clock = new MutableClock();
            IpFilter ipFilter = new IpFilter(Set.of(), 3, BanPolicy.permanent(), clock);
            ipFilter.recordFailedAttempt("10.0.0.1");
            clock.advance(Duration.ofHours(2));
            ipFilter.recordFailedAttempt("10.0.0.2");

            assertEquals(0, ipFilter.pruneStale(Duration.ofHours(3)));
            clock.advance(Duration.ofHours(2));

            assertEquals(1, ipFilter.pruneStale(Duration.ofHours(3)));
            assertEquals(0, ipFilter.getFailedAttempts("10.0.0.1"));
            assertEquals(1, ipFilter.getFailedAttempts("10.0.0.2"));
            assertEquals(1, ipFilter.trackedIps());
        }

        @Test
        void testBlockedIpsAreKept() {
            MutableClock clock = new MutableClock();
            IpFilter ipFilter = new IpFilter(Set.of(), 1, BanPolicy.permanent(), clock);
            ipFilter.recordFailedAttempt("10.0.0.1");
            clock.advance(Duration.ofDays(2));

            assertEquals(0, ipFilter.pruneStale(Duration.ofHours(1)));
            assertTrue(ipFilter.isBlocked("10.0.0.1"));
        }

        @Test
        void testExpiredBansAreLifted() {
            MutableClock clock = new MutableClock();
            IpFilter ipFilter = new IpFilter(Set.of(), 1, BanPolicy.ofDuration(Duration.ofMinutes(10)), clock);
            ipFilter.recordFailedAttempt("10.0.0.1");
            clock.advance(Duration.ofMinutes(11));

            ipFilter.pruneStale(Duration.ofHours(1));

            assertThat(ipFilter.getBlockedIps()).isEmpty();
            assertEquals(0, ipFilter.trackedIps());
        }
    }
}
