package com.interlockingbrick.scoring.repository;

import com.interlockingbrick.scoring.model.MetaEntry;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MetaEntryRepository extends JpaRepository<MetaEntry, String> {
}
