package net.medroute.core.service;

import net.medroute.core.model.CareProfile;
import net.medroute.core.model.RejectReason;
import net.medroute.core.model.ResourceSnapshot;

/**
 * 병원 한 곳의 침대/인력/물자 풀.
 * 모든 변경은 모니터 락 아래에서 한 번에 끝난다. 0 <= available <= total 유지.
 */
public final class ResourcePool {
    private final int bedsTotal;
    private final int staffTotal;
    private final int suppliesTotal;

    private int bedsAvailable;
    private int staffAvailable;
    private int suppliesAvailable;

    public ResourcePool(int beds, int staff, int supplies) {
        if (beds < 0 || staff < 0 || supplies < 0) {
            throw new IllegalArgumentException("resource totals must be >= 0: beds=" + beds + " staff=" + staff + " supplies=" + supplies);
        }
        this.bedsTotal = beds;
        this.staffTotal = staff;
        this.suppliesTotal = supplies;
        this.bedsAvailable = beds;
        this.staffAvailable = staff;
        this.suppliesAvailable = supplies;
    }

    /** 세 자원을 함께 확인 후 차감. 실패 시 아무것도 바꾸지 않고 첫 번째 부족 사유(beds → staff → supplies) */
    public synchronized Reservation tryReserve(CareProfile profile) {
        if (bedsAvailable < CareProfile.BEDS) return Reservation.denied(RejectReason.NO_BEDS);
        if (staffAvailable < profile.staff()) return Reservation.denied(RejectReason.NO_STAFF);
        if (suppliesAvailable < profile.supplies()) return Reservation.denied(RejectReason.NO_SUPPLIES);

        bedsAvailable -= CareProfile.BEDS;
        staffAvailable -= profile.staff();
        suppliesAvailable -= profile.supplies();
        return Reservation.GRANTED;
    }

    /** 성공한 예약 1건당 정확히 1회, 예약했던 그 프로파일로 호출 */
    public synchronized void release(CareProfile profile) {
        bedsAvailable = Math.min(bedsTotal, bedsAvailable + CareProfile.BEDS);
        staffAvailable = Math.min(staffTotal, staffAvailable + profile.staff());
        suppliesAvailable = Math.min(suppliesTotal, suppliesAvailable + profile.supplies());
    }

    public synchronized ResourceSnapshot snapshot() {
        return ResourceSnapshot.of(bedsAvailable, bedsTotal, staffAvailable, staffTotal,
                suppliesAvailable, suppliesTotal);
    }

    public synchronized int bedsAvailable() { return bedsAvailable; }

    public int bedsTotal() { return bedsTotal; }
    public int staffTotal() { return staffTotal; }
    public int suppliesTotal() { return suppliesTotal; }

    public record Reservation(boolean granted, RejectReason reason) {
        static final Reservation GRANTED = new Reservation(true, null);

        static Reservation denied(RejectReason reason) {
            return new Reservation(false, reason);
        }
    }
}
