package com.interlockingbrick.scoring.repository;

import com.interlockingbrick.scoring.model.TeamEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TeamEntryRepository extends JpaRepository<TeamEntry, Integer> {
    List<TeamEntry> findAllByOrderByTeamNumberAsc();
}
