package com.github.dimitryivaniuta.responsecache.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.responsecache.config.JacksonConfig;
import com.github.dimitryivaniuta.responsecache.store.HashStoreClient;
import com.github.dimitryivaniuta.responsecache.web.CachedBodyRequest;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class RequestFingerprinterTest {

    private final ObjectMapper mapper = JacksonConfig.configure(new ObjectMapper());

    private RequestFingerprinter fingerprinter(List<String> headers, boolean includeBody) {
        ResponseCacheSettings settings = ResponseCacheSettings.builder()
                .headers(headers)
                .includeBody(includeBody)
                .client(mock(HashStoreClient.class))
                .build();
        return new RequestFingerprinter(settings, mapper);
    }

    private static CachedBodyRequest jsonPost(String uri, String json) {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", uri);
        req.setContentType("application/json");
        req.setContent(json.getBytes(StandardCharsets.UTF_8));
        return new CachedBodyRequest(req);
    }

    private static CachedBodyRequest formPost(String uri, String form) {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", uri);
        req.setContentType("application/x-www-form-urlencoded");
        req.setContent(form.getBytes(StandardCharsets.UTF_8));
        return new CachedBodyRequest(req);
    }

    private static String sha1(String input) throws Exception {
        byte[] digest = MessageDigest.getInstance("SHA-1").digest(input.getBytes(StandardCharsets.UTF_8));
        StringBuilder sb = new StringBuilder();
        for (byte b : digest) sb.append(String.format("%02x", b));
        return sb.toString();
    }

    @Test
    void shouldHashOriginalUrlWithSha1Hex() throws Exception {
        String key = fingerprinter(List.of(), true).fingerprint(new MockHttpServletRequest("GET", "/cached"));

        // sha1("/cached")
        assertThat(key).isEqualTo("8de891c389a6dfb0e691b4f95a22ee0a39aa30d0");
    }

    @Test
    void shouldFeedUndefinedForMissingHeader() throws Exception {
        String key = fingerprinter(List.of("Authorization"), true)
                .fingerprint(new MockHttpServletRequest("GET", "/cached"));

        // sha1("undefined/cached")
        assertThat(key).isEqualTo("60f8077ab547bac21faf9c057b7057d5e4c215a1");
    }

    @Test
    void shouldFeedHeaderValuesThenUrlWithQuery() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/cached");
        req.setQueryString("page=2");
        req.addHeader("Authorization", "Bearer abc");

        String key = fingerprinter(List.of("Authorization"), true).fingerprint(req);

        // sha1("Bearer abc/cached?page=2")
        assertThat(key).isEqualTo("901c7b14b317df2cf0003683ab5c5df2e8039bae");
    }

    @Test
    void shouldBeStableAcrossRepeatedComputations() throws Exception {
        RequestFingerprinter fp = fingerprinter(List.of("Authorization", "Accept-Language"), true);

        MockHttpServletRequest a = new MockHttpServletRequest("GET", "/orders");
        a.addHeader("Authorization", "Bearer x");
        a.addHeader("Accept-Language", "pl");
        MockHttpServletRequest b = new MockHttpServletRequest("GET", "/orders");
        b.addHeader("Accept-Language", "pl");
        b.addHeader("Authorization", "Bearer x");

        assertThat(fp.fingerprint(a)).isEqualTo(fp.fingerprint(b)).isEqualTo(fp.fingerprint(a));
    }

    @Test
    void shouldDependOnConfiguredHeaderOrder() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/orders");
        req.addHeader("X-A", "1");
        req.addHeader("X-B", "2");

        String ab = fingerprinter(List.of("X-A", "X-B"), true).fingerprint(req);
        String ba = fingerprinter(List.of("X-B", "X-A"), true).fingerprint(req);

        assertThat(ab).isNotEqualTo(ba);
    }

    @Test
    void shouldIgnoreHeadersThatAreNotConfigured() throws Exception {
        RequestFingerprinter fp = fingerprinter(List.of(), true);
        MockHttpServletRequest plain = new MockHttpServletRequest("GET", "/orders");
        MockHttpServletRequest withHeader = new MockHttpServletRequest("GET", "/orders");
        withHeader.addHeader("Authorization", "Bearer x");

        assertThat(fp.fingerprint(plain)).isEqualTo(fp.fingerprint(withHeader));
    }

    @Test
    void shouldIncludeQueryString() throws Exception {
        RequestFingerprinter fp = fingerprinter(List.of(), true);
        MockHttpServletRequest p1 = new MockHttpServletRequest("GET", "/orders");
        p1.setQueryString("page=1");
        MockHttpServletRequest p2 = new MockHttpServletRequest("GET", "/orders");
        p2.setQueryString("page=2");

        assertThat(fp.fingerprint(p1)).isNotEqualTo(fp.fingerprint(p2));
    }

    @Test
    void shouldCanonicalizeJsonBodyWhitespaceButKeepKeyOrder() throws Exception {
        RequestFingerprinter fp = fingerprinter(List.of(), true);

        String compact = fp.fingerprint(jsonPost("/search", "{\"b\":1,\"a\":[1,2]}"));
        String spaced = fp.fingerprint(jsonPost("/search", "{ \"b\" : 1,\n  \"a\" : [ 1, 2 ] }"));
        String reordered = fp.fingerprint(jsonPost("/search", "{\"a\":[1,2],\"b\":1}"));

        assertThat(compact).isEqualTo(spaced);
        assertThat(compact).isNotEqualTo(reordered);
    }

    @Test
    void shouldWriteJsonFloatsWithoutTrailingZeros() throws Exception {
        RequestFingerprinter fp = fingerprinter(List.of(), true);

        assertThat(fp.fingerprint(jsonPost("/search", "{\"n\":1.0}")))
                .isEqualTo(fp.fingerprint(jsonPost("/search", "{\"n\":1}")));
        assertThat(fp.fingerprint(jsonPost("/search", "{\"n\":1e2}")))
                .isEqualTo(fp.fingerprint(jsonPost("/search", "{\"n\":100}")));
        assertThat(fp.fingerprint(jsonPost("/search", "{\"n\":1.5}")))
                .isNotEqualTo(fp.fingerprint(jsonPost("/search", "{\"n\":1}")));
    }

    @Test
    void shouldFeedFormFieldsAsJson() throws Exception {
        String expected = sha1("{\"to\":\"alice\",\"amount\":\"10\"}/transfer");

        String key = fingerprinter(List.of(), true).fingerprint(formPost("/transfer", "to=alice&amount=10"));

        assertThat(key).isEqualTo(expected);
    }

    @Test
    void shouldSeparateDifferentFormBodies() throws Exception {
        RequestFingerprinter fp = fingerprinter(List.of(), true);

        assertThat(fp.fingerprint(formPost("/transfer", "to=alice")))
                .isNotEqualTo(fp.fingerprint(formPost("/transfer", "to=bob")));
        assertThat(fp.fingerprint(formPost("/transfer", "to=a%20b")))
                .isEqualTo(fp.fingerprint(formPost("/transfer", "to=a+b")));
    }

    @Test
    void shouldFeedRepeatedFormFieldsAsArray() throws Exception {
        String key = fingerprinter(List.of(), true).fingerprint(formPost("/tags", "tag=a&tag=b&flag"));

        assertThat(key).isEqualTo(sha1("{\"tag\":[\"a\",\"b\"],\"flag\":\"\"}/tags"));
    }

    @Test
    void shouldIgnoreEmptyFormBody() throws Exception {
        RequestFingerprinter fp = fingerprinter(List.of(), true);

        assertThat(fp.fingerprint(formPost("/transfer", "")))
                .isEqualTo(fp.fingerprint(new MockHttpServletRequest("POST", "/transfer")));
    }

    @Test
    void shouldIgnoreBodyWhenDisabled() throws Exception {
        RequestFingerprinter fp = fingerprinter(List.of(), false);

        assertThat(fp.fingerprint(jsonPost("/search", "{\"q\":\"a\"}")))
                .isEqualTo(fp.fingerprint(jsonPost("/search", "{\"q\":\"b\"}")));
    }

    @Test
    void shouldIgnoreScalarAndInvalidBodies() throws Exception {
        RequestFingerprinter fp = fingerprinter(List.of(), true);
        String none = fp.fingerprint(new MockHttpServletRequest("POST", "/search"));

        assertThat(fp.fingerprint(jsonPost("/search", "\"just a string\""))).isEqualTo(none);
        assertThat(fp.fingerprint(jsonPost("/search", "{not json"))).isEqualTo(none);
        assertThat(fp.fingerprint(jsonPost("/search", "{\"q\":\"a\"} trailing"))).isEqualTo(none);
    }

    @Test
    void shouldIgnoreNonJsonBodies() throws Exception {
        RequestFingerprinter fp = fingerprinter(List.of(), true);
        MockHttpServletRequest text = new MockHttpServletRequest("POST", "/search");
        text.setContentType("text/plain");
        text.setContent("{\"q\":\"a\"}".getBytes(StandardCharsets.UTF_8));

        assertThat(fp.fingerprint(new CachedBodyRequest(text)))
                .isEqualTo(fp.fingerprint(new MockHttpServletRequest("POST", "/search")));
    }

    @Test
    void shouldLeaveBodyReadableAfterFingerprinting() throws Exception {
        CachedBodyRequest req = jsonPost("/search", "{\"q\":\"a\"}");

        fingerprinter(List.of(), true).fingerprint(req);

        assertThat(new String(req.getInputStream().readAllBytes(), StandardCharsets.UTF_8))
                .isEqualTo("{\"q\":\"a\"}");
    }
}
