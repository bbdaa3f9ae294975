package com.interlockingbrick.scoring.repository;

import com.interlockingbrick.scoring.model.ScoresheetEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ScoresheetEntryRepository extends JpaRepository<ScoresheetEntry, String> {
    List<ScoresheetEntry> findByTeamNumberOrderByRoundAsc(int teamNumber);
}
