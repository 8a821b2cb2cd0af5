package com.gt.linker.reconcile;

import com.gt.linker.reconcile.model.ReconciliationResult;
import com.gt.linker.reconcile.model.SyncStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/rest/sync")
public class ReconciliationController {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationController.class);

    private final ReconciliationService reconciliationService;

    @Autowired
    public ReconciliationController(ReconciliationService reconciliationService) {
        this.reconciliationService = reconciliationService;
    }

    @PostMapping("/refresh")
    public ResponseEntity<ReconciliationResult> refresh() {
        return reconciliationService.reconcileNow()
                .map(ResponseEntity::ok)
                .orElseGet(() -> {
                    log.debug("Refresh requested while reconciliation is running");
                    return ResponseEntity.status(HttpStatus.ACCEPTED).build();
                });
    }

    @GetMapping("/status")
    public SyncStatus getStatus() {
        return reconciliationService.getStatus();
    }
}
