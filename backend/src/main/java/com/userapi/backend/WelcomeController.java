package com.userapi.backend;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
class WelcomeController {

    @Value("${app.version:1.0.0}")
    private String version;

    @GetMapping("/")
    public Map<String, Object> welcome() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "welcome to the user api");
        body.put("version", version);
        return body;
    }
}
