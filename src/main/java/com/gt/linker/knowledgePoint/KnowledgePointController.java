package com.gt.linker.knowledgePoint;

import com.gt.linker.knowledgePoint.model.BatchActionResult;
import com.gt.linker.knowledgePoint.model.KnowledgePointBatchRequest;
import com.gt.linker.knowledgePoint.model.KnowledgePointFilter;
import com.gt.linker.knowledgePoint.model.KnowledgePointSort;
import com.gt.linker.knowledgePoint.model.KnowledgePointView;
import com.gt.linker.model.BatchAction;
import com.gt.linker.model.KnowledgePointContent;
import com.gt.linker.model.MasteryTier;
import com.gt.linker.model.ReviewOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

@RestController
@RequestMapping("/rest/knowledgePoint")
public class KnowledgePointController {

    private static final Logger log = LoggerFactory.getLogger(KnowledgePointController.class);

    private final KnowledgePointRepository knowledgePointRepository;

    @Autowired
    public KnowledgePointController(KnowledgePointRepository knowledgePointRepository) {
        this.knowledgePointRepository = knowledgePointRepository;
    }

    @GetMapping(value = "/active", produces = "application/json")
    public List<KnowledgePointView> getActive(@RequestParam(value = "tier", required = false) String tier,
                                              @RequestParam(value = "category", required = false) String category,
                                              @RequestParam(value = "sort", required = false) String sort) {
        return knowledgePointRepository.fetchActive(toFilter(tier, category, sort));
    }

    @GetMapping(value = "/archived", produces = "application/json")
    public List<KnowledgePointView> getArchived(@RequestParam(value = "tier", required = false) String tier,
                                                @RequestParam(value = "category", required = false) String category,
                                                @RequestParam(value = "sort", required = false) String sort) {
        return knowledgePointRepository.fetchArchived(toFilter(tier, category, sort));
    }

    @GetMapping(value = "/{id}", produces = "application/json")
    public KnowledgePointView getKnowledgePoint(@PathVariable("id") String effectiveId) {
        return knowledgePointRepository.find(effectiveId);
    }

    @PostMapping(consumes = "application/json", produces = "application/json")
    public CompletableFuture<KnowledgePointView> createKnowledgePoint(@RequestBody KnowledgePointContent content) {
        return knowledgePointRepository.create(content);
    }

    @PostMapping(value = "/{id}/archive", produces = "application/json")
    public CompletableFuture<KnowledgePointView> archive(@PathVariable("id") String effectiveId) {
        return knowledgePointRepository.archive(effectiveId);
    }

    @PostMapping(value = "/{id}/unarchive", produces = "application/json")
    public CompletableFuture<KnowledgePointView> unarchive(@PathVariable("id") String effectiveId) {
        return knowledgePointRepository.unarchive(effectiveId);
    }

    @DeleteMapping("/{id}")
    public CompletableFuture<Void> delete(@PathVariable("id") String effectiveId) {
        return knowledgePointRepository.delete(effectiveId);
    }

    @PostMapping(value = "/{id}/outcome", consumes = "application/json", produces = "application/json")
    public CompletableFuture<KnowledgePointView> submitOutcome(@PathVariable("id") String effectiveId,
                                                               @RequestBody ReviewOutcome outcome) {
        return knowledgePointRepository.updateMastery(effectiveId, outcome);
    }

    @PostMapping(value = "/batch", consumes = "application/json", produces = "application/json")
    public CompletableFuture<BatchActionResult> batchAction(@RequestBody KnowledgePointBatchRequest request) {
        BatchAction action = parse(request.action(), BatchAction::fromCode);
        List<String> ids = request.ids() == null ? List.of() : request.ids();

        return knowledgePointRepository.batchAction(action, ids);
    }

    private static KnowledgePointFilter toFilter(String tier, String category, String sort) {
        return new KnowledgePointFilter(
                tier == null || tier.isBlank() ? null : parse(tier, MasteryTier::fromCode),
                category == null || category.isBlank() ? null : category,
                parse(sort, KnowledgePointSort::fromCode));
    }

    private static <T> T parse(String value, Function<String, T> parser) {
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException ex) {
            log.debug("Rejecting request parameter: {}", ex.getMessage());
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }
}
