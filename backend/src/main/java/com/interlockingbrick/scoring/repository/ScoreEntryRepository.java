package com.interlockingbrick.scoring.repository;

import com.interlockingbrick.scoring.model.ScoreEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ScoreEntryRepository extends JpaRepository<ScoreEntry, String> {
    List<ScoreEntry> findByTeamNumberOrderByRoundAsc(int teamNumber);

    List<ScoreEntry> findAllByOrderByTeamNumberAscRoundAsc();
}
