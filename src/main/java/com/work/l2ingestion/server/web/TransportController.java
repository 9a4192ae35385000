package com.work.l2ingestion.server.web;

import com.work.l2ingestion.core.exception.InvalidArgumentException;
import com.work.l2ingestion.core.exception.NotFoundException;
import com.work.l2ingestion.core.model.EnqueueEntry;
import com.work.l2ingestion.core.model.TransactionEntry;
import com.work.l2ingestion.server.service.TransportQueryService;
import com.work.l2ingestion.server.web.dto.EventCursorResponse;
import com.work.l2ingestion.server.web.dto.StateRootBatchResponse;
import com.work.l2ingestion.server.web.dto.StateRootResponse;
import com.work.l2ingestion.server.web.dto.SyncStatusResponse;
import com.work.l2ingestion.server.web.dto.TransactionBatchResponse;
import com.work.l2ingestion.server.web.dto.TransactionResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import javax.validation.ConstraintViolationException;
import javax.validation.constraints.Min;
import java.util.List;

/**
 * 只读 REST 接口，路径与下游 data transport 客户端约定一致。
 */
@RestController
@Validated
public class TransportController {

    private final TransportQueryService queryService;

    public TransportController(TransportQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping("/eth/syncing")
    public SyncStatusResponse syncing() {
        return queryService.getSyncStatus();
    }

    @GetMapping("/enqueue/index/{index}")
    public EnqueueEntry enqueue(@PathVariable @Min(0) long index) {
        return queryService.getEnqueue(index);
    }

    @GetMapping("/enqueue/latest")
    public EnqueueEntry latestEnqueue() {
        return queryService.getLatestEnqueue();
    }

    @GetMapping("/transaction/index/{index}")
    public TransactionResponse transaction(@PathVariable @Min(0) long index) {
        return queryService.getTransaction(index);
    }

    @GetMapping("/transaction/latest")
    public TransactionResponse latestTransaction() {
        return queryService.getLatestTransaction();
    }

    @GetMapping("/transaction/range")
    public List<TransactionEntry> transactionRange(@RequestParam("start") @Min(0) long start,
                                                   @RequestParam("end") @Min(0) long end) {
        return queryService.getTransactionRange(start, end, false);
    }

    @GetMapping("/batch/transaction/index/{index}")
    public TransactionBatchResponse transactionBatch(@PathVariable @Min(0) long index) {
        return queryService.getTransactionBatch(index);
    }

    @GetMapping("/batch/transaction/latest")
    public TransactionBatchResponse latestTransactionBatch() {
        return queryService.getLatestTransactionBatch();
    }

    @GetMapping("/stateroot/index/{index}")
    public StateRootResponse stateRoot(@PathVariable @Min(0) long index) {
        return queryService.getStateRoot(index);
    }

    @GetMapping("/stateroot/latest")
    public StateRootResponse latestStateRoot() {
        return queryService.getLatestStateRoot();
    }

    @GetMapping("/batch/stateroot/index/{index}")
    public StateRootBatchResponse stateRootBatch(@PathVariable @Min(0) long index) {
        return queryService.getStateRootBatch(index);
    }

    @GetMapping("/batch/stateroot/latest")
    public StateRootBatchResponse latestStateRootBatch() {
        return queryService.getLatestStateRootBatch();
    }

    @GetMapping("/unconfirmed/transaction/index/{index}")
    public TransactionResponse unconfirmedTransaction(@PathVariable @Min(0) long index) {
        return queryService.getUnconfirmedTransaction(index);
    }

    @GetMapping("/unconfirmed/transaction/latest")
    public TransactionResponse latestUnconfirmedTransaction() {
        return queryService.getLatestUnconfirmedTransaction();
    }

    @GetMapping("/unconfirmed/transaction/range")
    public List<TransactionEntry> unconfirmedTransactionRange(@RequestParam("start") @Min(0) long start,
                                                              @RequestParam("end") @Min(0) long end) {
        return queryService.getTransactionRange(start, end, true);
    }

    @GetMapping("/unconfirmed/stateroot/index/{index}")
    public StateRootResponse unconfirmedStateRoot(@PathVariable @Min(0) long index) {
        return queryService.getUnconfirmedStateRoot(index);
    }

    @GetMapping("/unconfirmed/stateroot/latest")
    public StateRootResponse latestUnconfirmedStateRoot() {
        return queryService.getLatestUnconfirmedStateRoot();
    }

    @GetMapping("/event/{watcher}/last-scanned")
    public EventCursorResponse lastScanned(@PathVariable("watcher") String watcher) {
        return queryService.getLastScanned(watcher);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<String> handleNotFound(NotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
    }

    @ExceptionHandler({InvalidArgumentException.class, ConstraintViolationException.class})
    public ResponseEntity<String> handleBadRequest(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(e.getMessage());
    }
}
