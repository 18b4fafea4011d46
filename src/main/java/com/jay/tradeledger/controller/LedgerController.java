package com.jay.tradeledger.controller;

import com.jay.tradeledger.entity.Position;
import com.jay.tradeledger.entity.TradeOrder;
import com.jay.tradeledger.model.OrderUpdateSummary;
import com.jay.tradeledger.model.ReconcileResult;
import com.jay.tradeledger.model.SignalView;
import com.jay.tradeledger.model.enums.SignalStatus;
import com.jay.tradeledger.service.LedgerFacade;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REST API: Signal, order and position ledger.
 *
 * Endpoints:
 *   POST /api/signals/reconcile             : Apply a batch of signal payloads
 *   GET  /api/signals                       : Recent signals, optionally as one user sees them
 *   POST /api/signals/{symbol}/traded       : User acted on the current signal
 *   POST /api/signals/{symbol}/rejected     : User dismissed the current signal
 *   POST /api/signals/{symbol}/reactivate   : Undo a user's trade/reject mark
 *   POST /api/orders/updates                : Broker order callbacks
 *   GET  /api/orders/pending                : Orders awaiting execution
 *   GET  /api/positions                     : Open positions of a user
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class LedgerController {

    private final LedgerFacade ledger;

    // ── POST /api/signals/reconcile ────────────────────────────────────────────

    @PostMapping("/signals/reconcile")
    public ResponseEntity<ReconcileResult> reconcile(
            @RequestBody List<Map<String, Object>> signals,
            @RequestParam(required = false) Long userId,
            @RequestParam(defaultValue = "false") boolean skipGate) {
        return ResponseEntity.ok(ledger.reconcileSignals(signals, userId, skipGate));
    }

    // ── GET /api/signals ───────────────────────────────────────────────────────

    @GetMapping("/signals")
    public ResponseEntity<List<SignalView>> signals(
            @RequestParam(required = false) Long userId,
            @RequestParam(required = false) SignalStatus status,
            @RequestParam(defaultValue = "50") int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return ResponseEntity.ok(ledger.signals(userId, limit, status));
    }

    // ── POST /api/signals/{symbol}/... ─────────────────────────────────────────

    @PostMapping("/signals/{symbol}/traded")
    public ResponseEntity<Map<String, Object>> markTraded(@PathVariable String symbol,
                                                          @RequestParam(required = false) Long userId) {
        return marked(symbol, "TRADED", ledger.markSignalTraded(symbol.toUpperCase(Locale.ROOT), userId));
    }

    @PostMapping("/signals/{symbol}/rejected")
    public ResponseEntity<Map<String, Object>> markRejected(@PathVariable String symbol,
                                                            @RequestParam(required = false) Long userId) {
        return marked(symbol, "REJECTED", ledger.markSignalRejected(symbol.toUpperCase(Locale.ROOT), userId));
    }

    @PostMapping("/signals/{symbol}/reactivate")
    public ResponseEntity<Map<String, Object>> reactivate(@PathVariable String symbol,
                                                          @RequestParam Long userId) {
        return marked(symbol, "ACTIVE", ledger.reactivateSignal(symbol.toUpperCase(Locale.ROOT), userId));
    }

    // ── POST /api/orders/updates ───────────────────────────────────────────────

    @PostMapping("/orders/updates")
    public ResponseEntity<OrderUpdateSummary> orderUpdates(@RequestBody List<Map<String, Object>> updates) {
        return ResponseEntity.ok(ledger.applyOrderUpdates(updates));
    }

    // ── GET /api/orders/pending ────────────────────────────────────────────────

    @GetMapping("/orders/pending")
    public ResponseEntity<List<TradeOrder>> pendingOrders(@RequestParam(required = false) Long userId) {
        return ResponseEntity.ok(ledger.pendingOrders(userId));
    }

    // ── GET /api/positions ─────────────────────────────────────────────────────

    @GetMapping("/positions")
    public ResponseEntity<List<Position>> positions(@RequestParam Long userId) {
        return ResponseEntity.ok(ledger.openPositions(userId));
    }

    private static ResponseEntity<Map<String, Object>> marked(String symbol, String status, boolean applied) {
        return ResponseEntity.ok(Map.of(
            "symbol", symbol.toUpperCase(Locale.ROOT),
            "status", status,
            "applied", applied
        ));
    }
}
