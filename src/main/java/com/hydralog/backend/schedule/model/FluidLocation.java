package com.hydralog.backend.schedule.model;

public enum FluidLocation {
    SHOULDER_BLADE_LEFT,
    SHOULDER_BLADE_RIGHT,
    SHOULDER_BLADE_MIDDLE,
    HIP_BONES_LEFT,
    HIP_BONES_RIGHT
}
