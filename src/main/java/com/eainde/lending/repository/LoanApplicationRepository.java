package com.eainde.lending.repository;

import com.eainde.lending.model.LoanApplication;
import com.eainde.lending.service.LoanNotFoundException;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory loan store. Stands in for the external persistence layer; records are
 * mutated in place by the decision run, so every completed stage is visible immediately.
 */
@Repository
public class LoanApplicationRepository {

    private final ConcurrentMap<String, LoanApplication> loans = new ConcurrentHashMap<>();

    public LoanApplication save(LoanApplication loan) {
        loans.put(loan.getId(), loan);
        return loan;
    }

    public Optional<LoanApplication> findById(String id) {
        return Optional.ofNullable(loans.get(id));
    }

    /**
     * @throws LoanNotFoundException if no loan has this id
     */
    public LoanApplication require(String id) {
        return findById(id).orElseThrow(() -> new LoanNotFoundException(id));
    }

    public List<LoanApplication> findAll() {
        return loans.values().stream()
                .sorted(Comparator.comparing(LoanApplication::getCreatedAt))
                .toList();
    }
}
