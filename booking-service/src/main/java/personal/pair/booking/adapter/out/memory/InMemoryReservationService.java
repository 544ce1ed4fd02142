package personal.pair.booking.adapter.out.memory;

import lombok.extern.slf4j.Slf4j;
import personal.pair.booking.application.port.out.ReservationService;
import personal.pair.booking.domain.exception.BadSlotException;
import personal.pair.booking.domain.exception.ReservationLimitExceededException;
import personal.pair.booking.domain.exception.SlotUnavailableException;
import personal.pair.booking.domain.model.Receipt;
import personal.pair.booking.domain.model.Side;

import java.util.Collection;
import java.util.Random;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * In-Memory Reservation Service
 * 실제 서버 없이 메모리에서 슬롯 상태를 관리하는 어댑터
 *
 * 사용 환경:
 * - 단위/통합 테스트
 * - 데모 모드 (booking.mode=in-memory)
 *
 * 실제 서버와 같은 규칙을 따름:
 * - 1..slotCount 범위 밖 → BadSlot
 * - 보유 한도 초과 → ReservationLimitExceeded
 * - 다른 클라이언트가 가진 슬롯 → SlotUnavailable
 * - 보유하지 않은 슬롯 반납 → 성공 (멱등)
 */
@Slf4j
public class InMemoryReservationService implements ReservationService {

    private final Side side;
    private final int slotCount;
    private final int holdLimit;
    private final SortedSet<Integer> heldByUs = new TreeSet<>();
    private final SortedSet<Integer> takenByOthers = new TreeSet<>();

    public InMemoryReservationService(Side side, int slotCount, int holdLimit, Collection<Integer> takenByOthers) {
        this.side = side;
        this.slotCount = slotCount;
        this.holdLimit = holdLimit;
        for (int slotId : takenByOthers) {
            checkRange(slotId);
            this.takenByOthers.add(slotId);
        }
    }

    /**
     * 다른 클라이언트가 일정 비율로 선점한 상태에서 시작 (seed 고정 시 재현 가능)
     */
    public static InMemoryReservationService withRandomTaken(Side side, int slotCount, int holdLimit,
                                                             double takenRatio, long seed) {
        Random random = new Random(seed);
        Set<Integer> taken = new TreeSet<>();
        for (int slotId = 1; slotId <= slotCount; slotId++) {
            if (random.nextDouble() < takenRatio) {
                taken.add(slotId);
            }
        }
        log.info("In-memory {} service created: slots={}, holdLimit={}, takenByOthers={}",
                side.label(), slotCount, holdLimit, taken.size());
        return new InMemoryReservationService(side, slotCount, holdLimit, taken);
    }

    @Override
    public Side side() {
        return side;
    }

    @Override
    public synchronized Set<Integer> getAvailableSlots() {
        SortedSet<Integer> available = new TreeSet<>();
        for (int slotId = 1; slotId <= slotCount; slotId++) {
            if (!heldByUs.contains(slotId) && !takenByOthers.contains(slotId)) {
                available.add(slotId);
            }
        }
        return available;
    }

    @Override
    public synchronized Set<Integer> getHeldSlots() {
        return new TreeSet<>(heldByUs);
    }

    @Override
    public synchronized Receipt reserveSlot(int slotId) {
        checkRange(slotId);
        if (heldByUs.size() >= holdLimit) {
            throw new ReservationLimitExceededException(side,
                    "The client already holds the maximum number of slots (" + holdLimit + ")");
        }
        if (heldByUs.contains(slotId) || takenByOthers.contains(slotId)) {
            throw new SlotUnavailableException(side, "Slot " + slotId + " is already taken");
        }

        heldByUs.add(slotId);
        log.debug("[InMemory] {} slot reserved: slotId={}", side.label(), slotId);
        return new Receipt(side, slotId, "Slot reserved");
    }

    @Override
    public synchronized Receipt releaseSlot(int slotId) {
        checkRange(slotId);
        if (heldByUs.remove(slotId)) {
            log.debug("[InMemory] {} slot released: slotId={}", side.label(), slotId);
        }
        return new Receipt(side, slotId, "Slot released");
    }

    /**
     * 다른 클라이언트가 슬롯을 가져간 상황 재현
     */
    public synchronized void takeByOtherClient(int slotId) {
        checkRange(slotId);
        heldByUs.remove(slotId);
        takenByOthers.add(slotId);
    }

    public synchronized void releaseByOtherClient(int slotId) {
        takenByOthers.remove(slotId);
    }

    /**
     * 한도 검사 없이 보유 상태로 만든다 (테스트 초기 상태 구성용)
     */
    public synchronized void holdDirectly(int slotId) {
        checkRange(slotId);
        takenByOthers.remove(slotId);
        heldByUs.add(slotId);
    }

    private void checkRange(int slotId) {
        if (slotId < 1 || slotId > slotCount) {
            throw new BadSlotException(side, "Slot " + slotId + " does not exist");
        }
    }
}
