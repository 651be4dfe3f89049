package admit.java.client;

import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.SocketAddress;

import static org.junit.jupiter.api.Assertions.*;

class ClientIdentityTest {

    @Test
    void testForwardedFor_firstHopWins() {
        assertEquals("203.0.113.7", ClientIdentity.resolve(" 203.0.113.7 , 10.0.0.1, 10.0.0.2", "10.9.9.9", "127.0.0.1"));
        assertEquals("203.0.113.7", ClientIdentity.resolve("203.0.113.7", null, null));
    }

    @Test
    void testFallbackChain() {
        assertEquals("10.9.9.9", ClientIdentity.resolve(null, "10.9.9.9", "127.0.0.1"));
        assertEquals("10.9.9.9", ClientIdentity.resolve(" ,10.0.0.1", "10.9.9.9", "127.0.0.1"));
        assertEquals("127.0.0.1", ClientIdentity.resolve("", "  ", "127.0.0.1"));
        assertEquals(ClientIdentity.UNKNOWN, ClientIdentity.resolve(null, null, null));
    }

    @Test
    void testHostOf_stripsPort() {
        assertEquals("127.0.0.1", ClientIdentity.hostOf(new InetSocketAddress("127.0.0.1", 4242)));
        assertEquals("example.invalid", ClientIdentity.hostOf(InetSocketAddress.createUnresolved("example.invalid", 80)));
        assertNull(ClientIdentity.hostOf(null));
        assertNull(ClientIdentity.hostOf(new SocketAddress() {}));
    }
}
