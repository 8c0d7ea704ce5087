package com.example.sessionstore.repo;

import com.example.sessionstore.model.Host;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface HostRepo extends MongoRepository<Host, String> {
    Optional<Host> findByName(String name);
    boolean existsByName(String name);
    long deleteByName(String name);
}
