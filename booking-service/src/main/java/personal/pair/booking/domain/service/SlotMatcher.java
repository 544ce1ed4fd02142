package personal.pair.booking.domain.service;

import personal.pair.booking.domain.model.Side;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Slot Matcher
 * 슬롯 집합 간 순수 계산 (I/O, 상태 없음)
 * 빈 입력은 빈 결과를 반환하며 예외를 던지지 않는다
 */
public final class SlotMatcher {

    private SlotMatcher() {
    }

    /**
     * 짝 예약 후보 슬롯 (오름차순, 중복 없음)
     * (availableA ∩ availableB) ∪ (heldA ∩ availableB) ∪ (heldB ∩ availableA)
     */
    public static List<Integer> candidateSet(Set<Integer> availableA, Set<Integer> availableB,
                                             Set<Integer> heldA, Set<Integer> heldB) {
        SortedSet<Integer> candidates = intersect(availableA, availableB);
        candidates.addAll(intersect(heldA, availableB));
        candidates.addAll(intersect(heldB, availableA));
        return List.copyOf(candidates);
    }

    public static List<Integer> candidateSet(Set<Integer> availableA, Set<Integer> availableB,
                                             Set<Integer> heldA, Set<Integer> heldB, int limit) {
        List<Integer> candidates = candidateSet(availableA, availableB, heldA, heldB);
        return candidates.subList(0, Math.min(Math.max(limit, 0), candidates.size()));
    }

    /**
     * 양쪽 모두 보유 중인 슬롯 (heldA ∩ heldB)
     */
    public static SortedSet<Integer> matchedPairs(Set<Integer> heldA, Set<Integer> heldB) {
        return intersect(heldA, heldB);
    }

    /**
     * 한쪽에서만 보유 중인 슬롯 (heldA − heldB, heldB − heldA)
     */
    public static Unmatched unmatched(Set<Integer> heldA, Set<Integer> heldB) {
        return new Unmatched(subtract(heldA, heldB), subtract(heldB, heldA));
    }

    public static OptionalInt earliest(Set<Integer> slots) {
        return slots.stream().mapToInt(Integer::intValue).min();
    }

    /**
     * 오름차순 앞에서부터 limit 개
     */
    public static List<Integer> firstN(Set<Integer> slots, int limit) {
        List<Integer> sorted = new ArrayList<>(new TreeSet<>(slots));
        return List.copyOf(sorted.subList(0, Math.min(Math.max(limit, 0), sorted.size())));
    }

    private static SortedSet<Integer> intersect(Set<Integer> left, Set<Integer> right) {
        SortedSet<Integer> result = new TreeSet<>(left);
        result.retainAll(right);
        return result;
    }

    private static SortedSet<Integer> subtract(Set<Integer> left, Set<Integer> right) {
        SortedSet<Integer> result = new TreeSet<>(left);
        result.removeAll(right);
        return result;
    }

    public record Unmatched(
            SortedSet<Integer> onlyA,
            SortedSet<Integer> onlyB
    ) {
        public Unmatched {
            onlyA = Collections.unmodifiableSortedSet(onlyA);
            onlyB = Collections.unmodifiableSortedSet(onlyB);
        }

        public SortedSet<Integer> get(Side side) {
            return side == Side.HOTEL ? onlyA : onlyB;
        }

        public boolean isEmpty() {
            return onlyA.isEmpty() && onlyB.isEmpty();
        }
    }
}
