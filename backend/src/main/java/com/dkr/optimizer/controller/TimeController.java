package com.dkr.optimizer.controller;

import com.dkr.optimizer.util.TimeCodec;
import com.dkr.optimizer.util.TimeFormatException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

@RestController
@RequestMapping("/api/time")
@CrossOrigin(origins = "*")
public class TimeController {

    @GetMapping("/parse")
    public Map<String, Object> parse(@RequestParam String text) {
        try {
            int cs = TimeCodec.parse(text);
            return Map.of("text", text, "centiseconds", cs, "formatted", TimeCodec.format(cs));
        } catch (TimeFormatException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }

    @GetMapping("/format")
    public Map<String, Object> format(@RequestParam int cs) {
        if (cs < 0) throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "cs must be non-negative");
        return Map.of("centiseconds", cs, "formatted", TimeCodec.format(cs));
    }
}
