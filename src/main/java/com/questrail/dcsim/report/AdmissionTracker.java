package com.questrail.dcsim.report;

import com.questrail.dcsim.model.Request;
import com.questrail.dcsim.model.RequestStatus;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Admission counters over a request table. Requests flagged {@code ignored}
 * are left out.
 *
 * @param requests  counted requests
 * @param accepted  requests that were accepted (including since-stopped ones)
 * @param rejected  requests that were rejected
 */
public record AdmissionTracker(int requests, int accepted, int rejected)
{
    public static AdmissionTracker from(Collection<Request> table) {
        int requests = 0;
        int accepted = 0;
        int rejected = 0;
        for (Request request : table) {
            if (request.ignored()) {
                continue;
            }
            requests++;
            if (request.status() == RequestStatus.ACCEPTED || request.status() == RequestStatus.STOPPED) {
                accepted++;
            } else if (request.status() == RequestStatus.REJECTED) {
                rejected++;
            }
        }
        return new AdmissionTracker(requests, accepted, rejected);
    }

    /** Requests still waiting for a decision. */
    public int undecided() {
        return requests - accepted - rejected;
    }

    public double acceptRate() {
        return rate(accepted).doubleValue();
    }

    /**
     * Complement of the accept rate, so undecided requests count as rejected.
     */
    public double rejectRate() {
        if (requests == 0) {
            return 0.0;
        }
        return BigDecimal.ONE.subtract(rate(accepted)).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private BigDecimal rate(int count) {
        if (requests == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(count).divide(BigDecimal.valueOf(requests), 2, RoundingMode.HALF_UP);
    }
}
