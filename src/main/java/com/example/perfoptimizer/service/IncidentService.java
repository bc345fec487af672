package com.example.perfoptimizer.service;

import com.example.perfoptimizer.domain.Incident;
import com.example.perfoptimizer.event.OrchestratorEvent;
import com.example.perfoptimizer.event.OrchestratorEventListener;
import com.example.perfoptimizer.repository.IncidentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persists incidentCreated events and serves the incident list.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IncidentService implements OrchestratorEventListener {

    private static final int TITLE_LENGTH = 120;

    private final IncidentRepository incidentRepository;

    @Override
    public boolean supports(OrchestratorEvent.Type type) {
        return type == OrchestratorEvent.Type.INCIDENT_CREATED;
    }

    @Override
    public void onEvent(OrchestratorEvent event) {
        createIncident(event.getMessage(), Incident.Severity.from(event.getSeverity()),
                event.getSource() != null ? event.getSource() : "optimizer",
                Boolean.TRUE.equals(event.getAutomated()));
    }

    public Incident createIncident(String description, Incident.Severity severity, String source, boolean automated) {
        Incident incident = Incident.builder()
                .title(titleOf(description))
                .description(description)
                .severity(severity)
                .status(Incident.IncidentStatus.OPEN)
                .source(source)
                .automated(automated)
                .build();
        Incident saved = incidentRepository.save(incident);
        log.info("Incident {} created [{}] from {}: {}", saved.getId(), severity, source, saved.getTitle());
        return saved;
    }

    public List<Incident> getActiveIncidents() {
        return incidentRepository.findActiveIncidents();
    }

    public List<Incident> getAll() {
        return incidentRepository.findAll();
    }

    public Optional<Incident> get(String id) {
        return incidentRepository.findById(id);
    }

    public Optional<Incident> acknowledge(String id) {
        return incidentRepository.findById(id).map(incident -> {
            incident.setStatus(Incident.IncidentStatus.ACKNOWLEDGED);
            return incidentRepository.save(incident);
        });
    }

    public Optional<Incident> resolve(String id) {
        return incidentRepository.findById(id).map(incident -> {
            incident.setStatus(Incident.IncidentStatus.RESOLVED);
            incident.setResolvedAt(Instant.now());
            return incidentRepository.save(incident);
        });
    }

    private static String titleOf(String description) {
        if (description == null || description.isBlank()) {
            return "Automated incident";
        }
        String firstLine = description.lines().findFirst().orElse(description).trim();
        return firstLine.length() <= TITLE_LENGTH ? firstLine : firstLine.substring(0, TITLE_LENGTH - 3) + "...";
    }
}
