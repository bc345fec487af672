package com.example.perfoptimizer.repository;

import com.example.perfoptimizer.domain.Incident;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface IncidentRepository extends JpaRepository<Incident, String> {

    @Query("SELECT i FROM Incident i WHERE i.status IN ('OPEN', 'ACKNOWLEDGED') ORDER BY i.severity, i.createdAt DESC")
    List<Incident> findActiveIncidents();
}
