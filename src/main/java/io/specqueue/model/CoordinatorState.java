package io.specqueue.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class CoordinatorState {
    @JsonProperty("currentSource")
    @JsonAlias("current_source")
    private String currentSource;
    @JsonProperty("lastSwitch")
    @JsonAlias("last_switch")
    private Instant lastSwitch;
    @JsonProperty("sourceOrder")
    @JsonAlias("source_order")
    private List<String> sourceOrder = new ArrayList<>();

    public CoordinatorState() {
    }

    public String currentSource() {
        return currentSource;
    }

    public Instant lastSwitch() {
        return lastSwitch;
    }

    public List<String> sourceOrder() {
        return sourceOrder;
    }

    void normalize() {
        if (sourceOrder == null) {
            sourceOrder = new ArrayList<>();
        }
    }

    public void moveTo(String sourceId, Instant at) {
        this.currentSource = sourceId;
        this.lastSwitch = at;
    }

    public void reset() {
        this.currentSource = null;
        this.lastSwitch = null;
    }
}
