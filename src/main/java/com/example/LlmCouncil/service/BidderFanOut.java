package com.example.LlmCouncil.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Concurrent per-bidder calls joined into one result.
 * <p>
 * Every bidder runs on boundedElastic with its own failure boundary; a failing bidder only
 * produces a {@link Failure}. The join returns once every call has either returned or failed,
 * so the slowest call is bounded by the timeout that the model invocation enforces.
 */
public final class BidderFanOut {

    private static final Logger log = LoggerFactory.getLogger(BidderFanOut.class);

    private BidderFanOut() {
    }

    public static <T, R> Result<R> join(String stageName, List<T> bidders, Function<T, String> idOf, Function<T, R> call) {
        List<Indexed<T>> indexed = new ArrayList<>();
        for (int i = 0; i < bidders.size(); i++) {
            indexed.add(new Indexed<>(i, bidders.get(i)));
        }

        List<Outcome<R>> arrivals = Flux.fromIterable(indexed)
                .flatMap(entry -> Mono.fromCallable(() -> call.apply(entry.value()))
                        .subscribeOn(Schedulers.boundedElastic())
                        .map(value -> Outcome.<R>success(entry.index(), idOf.apply(entry.value()), value))
                        .onErrorResume(e -> {
                            String id = idOf.apply(entry.value());
                            log.warn("{}: bidder {} failed ({})", stageName, id, e.getMessage());
                            return Mono.just(Outcome.<R>failure(entry.index(), id, String.valueOf(e.getMessage())));
                        }))
                .collectList()
                .block();

        return new Result<>(arrivals == null ? List.of() : List.copyOf(arrivals));
    }

    private record Indexed<T>(int index, T value) {
    }

    /**
     * Outcome of one bidder's call; exactly one of value and error is set.
     */
    public record Outcome<R>(int index, String bidder, R value, String error) {

        static <R> Outcome<R> success(int index, String bidder, R value) {
            return new Outcome<>(index, bidder, value, null);
        }

        static <R> Outcome<R> failure(int index, String bidder, String error) {
            return new Outcome<>(index, bidder, null, error);
        }

        public boolean succeeded() {
            return error == null;
        }
    }

    /**
     * @param arrivals outcomes in the order the calls completed
     */
    public record Result<R>(List<Outcome<R>> arrivals) {

        /** Successful values in input order. */
        public List<R> successes() {
            return arrivals.stream()
                    .filter(Outcome::succeeded)
                    .sorted(Comparator.comparingInt(Outcome::index))
                    .map(Outcome::value)
                    .toList();
        }

        /** Successful values in completion order. */
        public List<R> successesInArrivalOrder() {
            return arrivals.stream().filter(Outcome::succeeded).map(Outcome::value).toList();
        }

        /** Bidders whose call failed, in input order. */
        public List<String> failedBidders() {
            return arrivals.stream()
                    .filter(o -> !o.succeeded())
                    .sorted(Comparator.comparingInt(Outcome::index))
                    .map(Outcome::bidder)
                    .toList();
        }
    }
}
