package com.shelfkeep.loanservice.api;

import com.shelfkeep.loanservice.api.dto.AvailabilityResponse;
import com.shelfkeep.loanservice.api.dto.ResizeCopiesRequest;
import com.shelfkeep.loanservice.domain.service.LoanOperations;
import com.shelfkeep.loanservice.infrastructure.web.LoanProblemException;
import com.shelfkeep.security.ActorContext;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Copy counters of catalog items. */
@RestController
@RequestMapping("/api/v1/items/{itemId}")
public class InventoryController {

    private final LoanOperations loans;

    public InventoryController(LoanOperations loans) {
        this.loans = loans;
    }

    @GetMapping("/availability")
    public AvailabilityResponse availability(ActorContext actor, @PathVariable String itemId) {
        return loans.itemAvailability(actor, itemId)
                .map(AvailabilityResponse::from)
                .orElseThrow(LoanProblemException::new);
    }

    /** Catalog edit of the total copy count; copies on loan stay on loan. */
    @PutMapping("/copies")
    public AvailabilityResponse resize(
            ActorContext actor,
            @PathVariable String itemId,
            @Valid @RequestBody ResizeCopiesRequest request) {
        return loans.resizeInventory(actor, itemId, request.totalCopies())
                .map(AvailabilityResponse::from)
                .orElseThrow(LoanProblemException::new);
    }
}
