package com.smartwealth.sectors.discovery.service;

import com.smartwealth.sectors.discovery.model.AcceptedCompany;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

@Component
public class CompanyRanker {
    private static final Comparator<AcceptedCompany> BY_MARKET_CAP_DESC =
        Comparator.comparingLong((AcceptedCompany company) -> company.record().marketCapOrZero())
            .reversed()
            .thenComparingInt(company -> company.candidate().discoveryIndex());

    public List<AcceptedCompany> rank(List<AcceptedCompany> accepted, int limit) {
        return accepted.stream()
            .sorted(BY_MARKET_CAP_DESC)
            .limit(Math.max(0, limit))
            .toList();
    }

    public boolean isSaturated(int acceptedCount, int limit) {
        return acceptedCount >= limit;
    }
}
