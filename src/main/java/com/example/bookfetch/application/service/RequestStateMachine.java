package com.example.bookfetch.application.service;

import com.example.bookfetch.common.exception.BusinessException;
import com.example.bookfetch.domain.enumtype.RequestStatus;
import com.example.bookfetch.infrastructure.persistence.mapper.RequestMapper;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Allowed request status changes, applied as guarded single-row updates.
 */
@Component
public class RequestStateMachine {

    private static final Logger log = LoggerFactory.getLogger(RequestStateMachine.class);

    /** Target status to the statuses it may be entered from. */
    private static final Map<RequestStatus, Set<RequestStatus>> SOURCES = new EnumMap<>(RequestStatus.class);

    static {
        Set<RequestStatus> active = EnumSet.noneOf(RequestStatus.class);
        for (RequestStatus status : RequestStatus.values()) {
            if (status.isActive()) {
                active.add(status);
            }
        }
        SOURCES.put(RequestStatus.PENDING, EnumSet.of(RequestStatus.AWAITING_APPROVAL));
        SOURCES.put(RequestStatus.AWAITING_APPROVAL, EnumSet.noneOf(RequestStatus.class));
        SOURCES.put(RequestStatus.AWAITING_SEARCH, EnumSet.of(RequestStatus.PENDING, RequestStatus.SEARCHING,
                RequestStatus.DOWNLOADING, RequestStatus.AWAITING_SEARCH, RequestStatus.FAILED, RequestStatus.WARN));
        SOURCES.put(RequestStatus.SEARCHING, EnumSet.of(RequestStatus.PENDING, RequestStatus.AWAITING_SEARCH,
                RequestStatus.SEARCHING));
        SOURCES.put(RequestStatus.DOWNLOADING, EnumSet.of(RequestStatus.SEARCHING, RequestStatus.DOWNLOADING));
        SOURCES.put(RequestStatus.DOWNLOADED, EnumSet.of(RequestStatus.DOWNLOADING));
        SOURCES.put(RequestStatus.PROCESSING, EnumSet.of(RequestStatus.DOWNLOADED, RequestStatus.AWAITING_IMPORT,
                RequestStatus.PROCESSING));
        SOURCES.put(RequestStatus.AWAITING_IMPORT, EnumSet.of(RequestStatus.DOWNLOADED, RequestStatus.PROCESSING,
                RequestStatus.AWAITING_IMPORT, RequestStatus.WARN, RequestStatus.FAILED));
        SOURCES.put(RequestStatus.AVAILABLE, EnumSet.of(RequestStatus.PROCESSING));
        SOURCES.put(RequestStatus.COMPLETED, EnumSet.of(RequestStatus.AVAILABLE));
        SOURCES.put(RequestStatus.FAILED, EnumSet.copyOf(active));
        SOURCES.put(RequestStatus.WARN, EnumSet.of(RequestStatus.DOWNLOADED, RequestStatus.PROCESSING,
                RequestStatus.AWAITING_IMPORT));
        SOURCES.put(RequestStatus.CANCELLED, EnumSet.copyOf(active));
        SOURCES.put(RequestStatus.DENIED, EnumSet.of(RequestStatus.AWAITING_APPROVAL));
    }

    private final RequestMapper requestMapper;

    public RequestStateMachine(RequestMapper requestMapper) {
        this.requestMapper = requestMapper;
    }

    public static boolean canTransition(RequestStatus from, RequestStatus to) {
        return from != null && to != null && SOURCES.get(to).contains(from);
    }

    public static List<String> sourcesOf(RequestStatus to) {
        List<String> values = new ArrayList<>();
        for (RequestStatus status : SOURCES.get(to)) {
            values.add(status.getValue());
        }
        return values;
    }

    /**
     * Rejects an API-driven transition that the current status does not allow.
     */
    public static void requireTransition(RequestStatus from, RequestStatus to) {
        if (!canTransition(from, to)) {
            throw new BusinessException("400",
                    "Cannot move request from " + (from == null ? "unknown" : from.getValue()) + " to " + to.getValue(),
                    "Refresh the request and check its current status");
        }
    }

    /**
     * @return {@code false} when the row had already left every allowed source status
     */
    public boolean transition(Long requestId, RequestStatus to, String errorMessage) {
        int updated = requestMapper.transition(requestId, sourcesOf(to), to.getValue(), errorMessage);
        if (updated == 0) {
            log.info("REQUEST_TRANSITION_SKIPPED requestId={} to={} currentStatus={}",
                    requestId, to.getValue(), requestMapper.selectStatusById(requestId));
            return false;
        }
        log.info("REQUEST_STATUS requestId={} to={}", requestId, to.getValue());
        return true;
    }

    public boolean transitionWithProgress(Long requestId, RequestStatus to, int progress) {
        int updated = requestMapper.transitionWithProgress(requestId, sourcesOf(to), to.getValue(), progress);
        if (updated == 0) {
            log.info("REQUEST_TRANSITION_SKIPPED requestId={} to={} currentStatus={}",
                    requestId, to.getValue(), requestMapper.selectStatusById(requestId));
            return false;
        }
        log.info("REQUEST_STATUS requestId={} to={} progress={}", requestId, to.getValue(), progress);
        return true;
    }

    /**
     * Whether stage processors should still act for this request.
     */
    public boolean isActive(Long requestId) {
        String status = requestMapper.selectStatusById(requestId);
        return status != null && RequestStatus.fromValue(status).isActive();
    }
}
