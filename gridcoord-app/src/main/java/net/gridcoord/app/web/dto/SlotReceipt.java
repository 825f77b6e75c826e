package net.gridcoord.app.web.dto;

import net.gridcoord.core.model.JobSlot;
import net.gridcoord.core.model.SlotState;

public record SlotReceipt(String id, SlotState state, int attempt, int progressPercent) {
    public static SlotReceipt of(JobSlot s) {
        return new SlotReceipt(s.id(), s.state(), s.attempt(), s.progressPercent());
    }
}
