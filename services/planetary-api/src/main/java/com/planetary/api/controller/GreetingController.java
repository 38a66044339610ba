package com.planetary.api.controller;

import com.planetary.api.dto.MessageResponse;
import com.planetary.api.util.TitleCase;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated greeting endpoints.
 *
 * The age gate is a plain response, not an error: under 18 gets 401 with a
 * rejection message, everyone else 200. A non-numeric age is rejected with 400
 * by GlobalExceptionHandler before the method runs.
 */
@RestController
public class GreetingController {

    static final int MINIMUM_AGE = 18;

    @GetMapping(value = "/", produces = MediaType.TEXT_PLAIN_VALUE)
    public String helloWorld() {
        return "Hello World!";
    }

    @GetMapping("/super_simple")
    public MessageResponse superSimple() {
        return new MessageResponse("hello Earth!");
    }

    @GetMapping("/parameters")
    public ResponseEntity<MessageResponse> parameters(@RequestParam String name,
                                                      @RequestParam int age) {
        return greet(name, age);
    }

    @GetMapping("/url_variables/{name}/{age}")
    public ResponseEntity<MessageResponse> urlVariables(@PathVariable String name,
                                                        @PathVariable int age) {
        return greet(name, age);
    }

    private ResponseEntity<MessageResponse> greet(String name, int age) {
        String displayName = TitleCase.apply(name);
        if (age < MINIMUM_AGE) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(new MessageResponse("Sorry " + displayName + ", you aren't old enough, get lost."));
        }
        return ResponseEntity.ok(new MessageResponse("Welcome back " + displayName + "."));
    }
}
