package net.medroute.core.model;

/** 특정 시점의 병원 자원 현황. 생성 후 불변 */
public record ResourceSnapshot(
        int bedsAvailable,
        int bedsTotal,
        int staffAvailable,
        int staffTotal,
        int suppliesAvailable,
        int suppliesTotal,
        double occupancy      // 침대 기준, 소수 둘째 자리
) {
    public static ResourceSnapshot of(int bedsAvailable, int bedsTotal,
                                      int staffAvailable, int staffTotal,
                                      int suppliesAvailable, int suppliesTotal) {
        double occ = bedsTotal == 0 ? 0.0 : (double) (bedsTotal - bedsAvailable) / bedsTotal;
        return new ResourceSnapshot(bedsAvailable, bedsTotal, staffAvailable, staffTotal,
                suppliesAvailable, suppliesTotal, roundOccupancy(occ));
    }

    public static double roundOccupancy(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    /** tryReserve 와 같은 순서(beds → staff → supplies)의 읽기 전용 판정. 충분하면 null */
    public RejectReason shortfallFor(CareProfile profile) {
        if (bedsAvailable < CareProfile.BEDS) return RejectReason.NO_BEDS;
        if (staffAvailable < profile.staff()) return RejectReason.NO_STAFF;
        if (suppliesAvailable < profile.supplies()) return RejectReason.NO_SUPPLIES;
        return null;
    }
}
