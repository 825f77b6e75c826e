package net.gridcoord.core.service;

import net.gridcoord.core.model.CloseReason;
import net.gridcoord.core.model.JobRequest;
import net.gridcoord.core.model.JobSlot;
import net.gridcoord.core.model.RequestState;
import net.gridcoord.core.model.RequestStatus;
import net.gridcoord.core.model.SlotState;

import java.util.Comparator;
import java.util.List;

final class RequestStatuses {
    private RequestStatuses() {}

    static boolean allTerminal(List<JobSlot> slots) {
        return !slots.isEmpty() && slots.stream().allMatch(s -> s.state().terminal());
    }

    /** 모든 슬롯이 종료된 요청의 최종 상태 */
    static RequestState finalStateOf(JobRequest request, List<JobSlot> slots) {
        long ok = slots.stream().filter(s -> s.state() == SlotState.SUBMITTED_OK).count();
        if (ok == slots.size()) return RequestState.COMPLETE;
        if (request.closeReason() == CloseReason.CANCELLED) return RequestState.CANCELLED;
        if (ok > 0) return RequestState.PARTIAL;
        if (request.closeReason() == CloseReason.EXPIRED) return RequestState.EXPIRED;
        return RequestState.FAILED;
    }

    static RequestStatus of(JobRequest request, List<JobSlot> slots) {
        int pending = 0, leased = 0, ok = 0, failed = 0, cancelled = 0;
        for (JobSlot s : slots) {
            switch (s.state()) {
                case PENDING -> pending++;
                case LEASED -> leased++;
                case SUBMITTED_OK -> ok++;
                case FAULTED, ABORTED_STALE -> failed++;
                case CANCELLED, EXPIRED -> cancelled++;
                default -> { }
            }
        }
        var views = slots.stream()
                .sorted(Comparator.comparingInt(JobSlot::slotIndex))
                .map(RequestStatus.SlotView::of)
                .toList();
        return new RequestStatus(request.id(), request.requesterId(), request.state(), request.slotCount(),
                pending, leased, ok, failed, cancelled, request.state().finished(),
                request.createdAt(), request.expiresAt(), request.finishedAt(), views);
    }
}
