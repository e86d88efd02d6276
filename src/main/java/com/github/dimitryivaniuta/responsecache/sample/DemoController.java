package com.github.dimitryivaniuta.responsecache.sample;

import com.github.dimitryivaniuta.responsecache.web.ResponseWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.Map;

/**
 * Demo endpoints. None of them is cache-aware: caching is decided by the filter and configuration
 * (see application.yml, "/api/demo/live" is listed under response-cache.disabled).
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/demo")
public class DemoController {

    private final DemoCounter counter;

    @GetMapping("/counter")
    public void counter(ResponseWriter res) throws IOException {
        res.status(200).json(Map.of("counter", counter.next()));
    }

    @GetMapping("/live/counter")
    public void liveCounter(ResponseWriter res) throws IOException {
        res.status(200).json(Map.of("counter", counter.next()));
    }

    @GetMapping("/short-lived")
    public void shortLived(@RequestParam(defaultValue = "5") String ttl, ResponseWriter res) throws IOException {
        res.ttl(ttl).json(Map.of("counter", counter.next(), "ttl", ttl));
    }

    @GetMapping("/report")
    public void report(ResponseWriter res) throws IOException {
        res.attachment("report.csv")
                .header("X-Report-Generation", String.valueOf(counter.next()))
                .send("id,value\n1,42\n");
    }

    @PostMapping(value = "/transfer", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public void transfer(@RequestParam String to, @RequestParam String amount, ResponseWriter res) throws IOException {
        res.json(Map.of("to", to, "amount", amount, "counter", counter.next()));
    }

    @PostMapping("/echo")
    public void echo(@RequestBody Map<String, Object> payload, ResponseWriter res) throws IOException {
        res.status(201).json(Map.of("received", payload, "counter", counter.next()));
    }
}
