package io.servicekit.restclient.auth;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CredentialsTest {

    @Test
    void bearerAndApiKeyProduceSingleHeader() throws Exception {
        assertEquals(Map.of("Authorization", "Bearer abc"), Credentials.bearer("abc").headers());
        assertEquals(Map.of("X-Api-Key", "k1"), Credentials.apiKey("X-Api-Key", "k1").headers());
    }

    @Test
    void basicEncodesUserAndPassword() throws Exception {
        assertEquals(Map.of("Authorization", "Basic dXNlcjpwYXNz"), Credentials.basic("user", "pass").headers());
    }

    @Test
    void tokensAskProviderOnEveryResolution() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        TokenProvider provider = () -> new Token("t" + calls.incrementAndGet(), null, null,
            Instant.now().plusSeconds(60));

        Credentials credentials = Credentials.tokens(provider);
        assertEquals("Bearer t1", credentials.headers().get("Authorization"));
        assertEquals("Bearer t2", credentials.headers().get("Authorization"));
    }

    @Test
    void rejectsBlankValues() {
        assertThrows(IllegalArgumentException.class, () -> Credentials.bearer(" "));
        assertThrows(IllegalArgumentException.class, () -> Credentials.apiKey("", "k"));
    }
}
