package com.subtrack.subbackend.subscription;

import com.subtrack.subbackend.subscription.dto.CreatedResponse;
import com.subtrack.subbackend.subscription.dto.SubscriptionDto;
import com.subtrack.subbackend.subscription.dto.SubscriptionRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/subscriptions")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;

    @PostMapping
    public ResponseEntity<CreatedResponse> create(@RequestBody SubscriptionRequest req) {
        UUID id = subscriptionService.create(req.toInput());
        return ResponseEntity.status(HttpStatus.CREATED).body(new CreatedResponse(id.toString()));
    }

    @GetMapping("/{id}")
    public SubscriptionDto get(@PathVariable String id) {
        return SubscriptionDto.from(subscriptionService.get(id));
    }

    @PutMapping("/{id}")
    public SubscriptionDto update(@PathVariable String id, @RequestBody SubscriptionRequest req) {
        return SubscriptionDto.from(subscriptionService.update(id, req.toInput()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        subscriptionService.delete(id);
        return ResponseEntity.noContent().build();
    }

    // ---- ?from=MM-YYYY&to=MM-YYYY, both optional --------------------
    @GetMapping
    public List<SubscriptionDto> list(@RequestParam(required = false) String from,
                                      @RequestParam(required = false) String to) {
        return subscriptionService.list(from, to)
                .stream()
                .map(SubscriptionDto::from)
                .toList();
    }
}
