package com.interlockingbrick.scoring.model;

import jakarta.persistence.*;

@Entity
@Table(name = "meta")
public class MetaEntry {

    public static final String SCHEMA_VERSION = "schema_version";
    public static final String EVENT_DATABASE = "event_database";
    public static final String CREATED_AT = "created_at";
    public static final String APP_VERSION = "app_version";

    @Id
    @Column(name = "meta_key", length = 64, nullable = false)
    private String key;

    @Column(name = "meta_value", length = 4000)
    private String value;

    public MetaEntry() {}

    public MetaEntry(String key, String value) {
        this.key = key;
        this.value = value;
    }

    public String getKey() { return key; }
    public void setKey(String key) { this.key = key; }

    public String getValue() { return value; }
    public void setValue(String value) { this.value = value; }
}
