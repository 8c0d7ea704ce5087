package com.example.sessionstore.controller;

import com.example.sessionstore.model.Host;
import com.example.sessionstore.service.HostService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Valid;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

@RestController
@RequestMapping("/hosts")
public class HostController {

    private static final Logger logger = LoggerFactory.getLogger(HostController.class);

    private final HostService hostService;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    public HostController(HostService hostService, ObjectMapper objectMapper, Validator validator) {
        this.hostService = hostService;
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    @GetMapping
    public Collection<Host> list() {
        return hostService.list();
    }

    @GetMapping("/{name}")
    public Host getByName(@PathVariable String name) {
        return hostService.getByName(name);
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Host create(@Valid @RequestBody Host host) {
        return hostService.create(host);
    }

    @PutMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Host update(@Valid @RequestBody Host host) {
        return hostService.update(host);
    }

    @DeleteMapping("/{name}")
    public void deleteByName(@PathVariable String name) {
        hostService.deleteByName(name);
    }

    /**
     * Imports a JSON array of hosts. The whole file is rejected when any host is invalid
     * or a name appears twice.
     */
    @PostMapping(value = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Map<String, Object> importHosts(@RequestPart("file") MultipartFile file) throws IOException {
        logger.info("Hosts import: name={}, size={}", file.getOriginalFilename(), file.getSize());

        List<Host> hosts;
        try (InputStream in = file.getInputStream()) {
            hosts = objectMapper.readValue(in, new TypeReference<List<Host>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid hosts file: " + e.getOriginalMessage(), e);
        }

        Set<String> names = new HashSet<>();
        for (Host host : hosts) {
            Set<ConstraintViolation<Host>> violations = validator.validate(host);
            if (!violations.isEmpty()) {
                ConstraintViolation<Host> v = violations.iterator().next();
                throw new IllegalArgumentException("Host '" + host.getName() + "': " + v.getPropertyPath() + " " + v.getMessage());
            }
            if (!names.add(host.getName())) {
                throw new IllegalArgumentException("Duplicate host: " + host.getName());
            }
        }

        hostService.saveAll(hosts);
        return Map.of("imported", hosts.size());
    }
}
