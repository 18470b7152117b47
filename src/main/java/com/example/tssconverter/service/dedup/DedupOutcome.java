package com.example.tssconverter.service.dedup;

public record DedupOutcome(int groupsCollapsed, int rowsRemoved, int blankKeyRows) {
}
