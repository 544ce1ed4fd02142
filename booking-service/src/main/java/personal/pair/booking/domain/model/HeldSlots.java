package personal.pair.booking.domain.model;

import personal.pair.booking.domain.service.SlotMatcher;

import java.util.Collections;
import java.util.OptionalInt;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Held Slots Snapshot
 * 특정 시점에 양쪽 서비스에서 보유 중인 슬롯 (캐시하지 않고 매번 새로 조회)
 */
public record HeldSlots(
        SortedSet<Integer> hotel,
        SortedSet<Integer> band
) {
    public HeldSlots {
        hotel = Collections.unmodifiableSortedSet(new TreeSet<>(hotel));
        band = Collections.unmodifiableSortedSet(new TreeSet<>(band));
    }

    public static HeldSlots of(Set<Integer> hotel, Set<Integer> band) {
        return new HeldSlots(new TreeSet<>(hotel), new TreeSet<>(band));
    }

    public static HeldSlots empty() {
        return new HeldSlots(new TreeSet<>(), new TreeSet<>());
    }

    public SortedSet<Integer> get(Side side) {
        return side == Side.HOTEL ? hotel : band;
    }

    public boolean holds(Side side, int slotId) {
        return get(side).contains(slotId);
    }

    public SortedSet<Integer> matchedPairs() {
        return SlotMatcher.matchedPairs(hotel, band);
    }

    public OptionalInt earliestMatchedPair() {
        return SlotMatcher.earliest(matchedPairs());
    }

    public SlotMatcher.Unmatched unmatched() {
        return SlotMatcher.unmatched(hotel, band);
    }

    /**
     * 어느 한쪽이라도 보유 한도에 도달했는지
     */
    public boolean underCapacityPressure(int threshold) {
        return hotel.size() >= threshold || band.size() >= threshold;
    }
}
