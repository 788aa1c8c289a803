package dev.etfaggregator.api;

import dev.etfaggregator.entity.UpdateRun;
import dev.etfaggregator.model.DividendSimulation;
import dev.etfaggregator.model.DividendSimulationRequest;
import dev.etfaggregator.model.EtfRecord;
import dev.etfaggregator.model.RunResult;
import dev.etfaggregator.model.UpdateSummary;
import dev.etfaggregator.scheduler.SchedulerStatus;
import dev.etfaggregator.scheduler.UpdateScheduler;
import dev.etfaggregator.service.DividendSimulator;
import dev.etfaggregator.service.RunHistoryService;
import dev.etfaggregator.service.UpdateOrchestrator;
import dev.etfaggregator.source.EtfSource;
import dev.etfaggregator.store.DatasetNames;
import dev.etfaggregator.store.InvalidDatasetNameException;
import dev.etfaggregator.store.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Read and trigger endpoints over the stored ETF listings.
 */
@Slf4j
@RestController
@RequestMapping("/api/etf")
@RequiredArgsConstructor
public class EtfController {

    private final UpdateOrchestrator orchestrator;
    private final UpdateScheduler scheduler;
    private final RunHistoryService runHistory;
    private final DividendSimulator dividendSimulator;

    @GetMapping("/sources")
    public List<String> sources() {
        return orchestrator.getSources().stream()
                .map(EtfSource::identity)
                .toList();
    }

    @GetMapping("/list/{collection}")
    public Mono<List<EtfRecord>> list(@PathVariable String collection) {
        return orchestrator.getCollection(collection)
                .flatMap(records -> records.isEmpty()
                        ? Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND,
                                "No data for collection '" + collection + "'"))
                        : Mono.just(records));
    }

    @GetMapping("/list")
    public Mono<Map<String, List<EtfRecord>>> listAll() {
        return orchestrator.getAll();
    }

    /**
     * Every stored record of every source, as one list.
     */
    @GetMapping("/all")
    public Mono<List<EtfRecord>> all() {
        return orchestrator.getAll()
                .map(byCollection -> byCollection.values().stream()
                        .flatMap(List::stream)
                        .toList());
    }

    @PostMapping("/update/{collection}")
    public Mono<RunResult> update(@PathVariable String collection,
                                  @RequestParam(defaultValue = "false") boolean force) {
        DatasetNames.sanitize(collection);
        return orchestrator.findSource(collection)
                .map(source -> orchestrator.updateOne(source, force))
                .orElseGet(() -> Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Unknown source '" + collection + "'")));
    }

    @PostMapping("/update")
    public Mono<UpdateSummary> updateAll(@RequestParam(defaultValue = "false") boolean force) {
        return orchestrator.updateAll(force);
    }

    /**
     * Projected distributions for an investment in one stored fund. 404 when no source lists
     * the ticker, 400 when the request is incomplete or the fund has no yield or NAV.
     */
    @PostMapping("/simulate-dividend")
    public Mono<DividendSimulation> simulateDividend(@RequestBody DividendSimulationRequest request) {
        return orchestrator.getAll()
                .map(byCollection -> dividendSimulator.simulate(byCollection, request))
                .onErrorMap(NoSuchElementException.class,
                        e -> new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage()))
                .onErrorMap(e -> e instanceof IllegalArgumentException,
                        e -> new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage()));
    }

    @GetMapping("/scheduler/status")
    public SchedulerStatus schedulerStatus() {
        return scheduler.status();
    }

    @PostMapping("/scheduler/run-now")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, String> runNow() {
        scheduler.runNow();
        return Map.of("status", "accepted");
    }

    @GetMapping("/runs")
    public Mono<List<UpdateRun>> runs(@RequestParam(defaultValue = "50") int limit) {
        return Mono.fromCallable(() -> runHistory.recentRuns(limit))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @ExceptionHandler(InvalidDatasetNameException.class)
    public ResponseEntity<Map<String, String>> invalidName(InvalidDatasetNameException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Map<String, String>> storageFailure(StorageException e) {
        log.error("Storage failure: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "storage failure"));
    }
}
