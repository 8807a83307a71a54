package com.example;

public class Thermostat {

    private final int target;

    public Thermostat(int target) { this.target = target; }

    public boolean heatingNeeded(int current) {
        if (current < target && !isHoliday()) {
            return true;
        }
        return false;
    }

    public boolean coolingNeeded(int current) {
        return current > target + 2;
    }

    private boolean isHoliday() { return false; }
}
