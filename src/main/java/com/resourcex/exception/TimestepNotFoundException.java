package com.resourcex.exception;

import java.time.Instant;

import lombok.Getter;

@Getter
public class TimestepNotFoundException extends ResourceNotFoundException {

    private final Instant timestep;

    public TimestepNotFoundException(Instant timestep) {
        super("Timestep " + timestep + " is not on the time axis");
        this.timestep = timestep;
    }
}
