package com.example.sessionstore.service;

import com.example.sessionstore.model.Host;
import com.example.sessionstore.repo.HostRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Service
public class HostService {

    private static final Logger logger = LoggerFactory.getLogger(HostService.class);

    private final HostRepo hostRepo;

    public HostService(HostRepo hostRepo) {
        this.hostRepo = hostRepo;
    }

    public Set<Host> list() {
        return new LinkedHashSet<>(hostRepo.findAll(Sort.by("name")));
    }

    public Host getByName(String name) {
        return hostRepo.findByName(name)
                .orElseThrow(() -> new EmptyResultDataAccessException("Host not found: " + name, 1));
    }

    public Host create(Host host) {
        if (hostRepo.existsByName(host.getName())) {
            throw new DuplicateKeyException("Host already exists: " + host.getName());
        }
        host.setId(null);
        Host saved = hostRepo.insert(host);
        logger.info("Host '{}' created", saved.getName());
        return saved;
    }

    public Host update(Host host) {
        Host existing = getByName(host.getName());
        host.setId(existing.getId());
        Host saved = hostRepo.save(host);
        logger.info("Host '{}' updated", saved.getName());
        return saved;
    }

    public void deleteByName(String name) {
        if (hostRepo.deleteByName(name) == 0) {
            throw new EmptyResultDataAccessException("Host not found: " + name, 1);
        }
        logger.info("Host '{}' deleted", name);
    }

    /**
     * Upserts by name: hosts already stored keep their id and get replaced.
     */
    public List<Host> saveAll(Collection<Host> hosts) {
        List<Host> toSave = new ArrayList<>(hosts.size());
        for (Host host : hosts) {
            host.setId(hostRepo.findByName(host.getName()).map(Host::getId).orElse(null));
            toSave.add(host);
        }
        List<Host> saved = hostRepo.saveAll(toSave);
        logger.info("Imported {} hosts", saved.size());
        return saved;
    }
}
