package com.pitwall.decoder;

import com.pitwall.domain.CarDataRecord;
import com.pitwall.domain.DriverRecord;
import com.pitwall.domain.LapRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Raw timing codes → application-friendly structures.
 *
 * All functions are pure and total: null or unrecognised input maps to a neutral
 * value instead of failing.
 */
public final class TelemetryDecoder {

    private TelemetryDecoder() {
    }

    /**
     * DRS 코드 해석
     * <pre>
     *   0, 1, null, 기타 → (enabled=false, available=false)
     *   8               → (false, true)
     *   10, 12, 14      → (true, true)
     * </pre>
     */
    public static DrsState decodeDrs(Integer value) {
        if (value == null) {
            return DrsState.OFF;
        }
        return switch (value) {
            case 8 -> DrsState.ARMED;
            case 10, 12, 14 -> DrsState.OPEN;
            default -> DrsState.OFF;
        };
    }

    public static SegmentStatus decodeSegment(Integer code) {
        return SegmentStatus.fromCode(code);
    }

    public static List<DecodedSegment> decodeSegments(List<Integer> segments) {
        if (segments == null) {
            return List.of();
        }

        List<DecodedSegment> decoded = new ArrayList<>(segments.size());
        for (Integer code : segments) {
            SegmentStatus status = decodeSegment(code);
            decoded.add(new DecodedSegment(code, status.getColour(), status.getMeaning(), status.getPerformance()));
        }
        return decoded;
    }

    /**
     * 섹터 안에서 가장 우선순위가 높은 등급
     * personal_best > best > pit > neutral
     */
    public static SectorPerformance sectorPerformance(List<Integer> segments) {
        SectorPerformance best = SectorPerformance.NEUTRAL;
        if (segments == null) {
            return best;
        }

        for (Integer code : segments) {
            SectorPerformance candidate = decodeSegment(code).getPerformance();
            if (candidate.outranks(best)) {
                best = candidate;
            }
        }
        return best;
    }

    /**
     * 주어진 segment 배열 중 하나라도 pit 코드를 포함하면 true
     */
    @SafeVarargs
    public static boolean isPitLane(List<Integer>... sectors) {
        if (sectors == null) {
            return false;
        }
        for (List<Integer> sector : sectors) {
            if (sector != null && sector.stream()
                    .anyMatch(code -> Objects.equals(code, SegmentStatus.PIT.getCode()))) {
                return true;
            }
        }
        return false;
    }

    /**
     * sector 1 에 pit 코드가 있거나, sector 2 에만 있고 sector 3 에는 없는 경우
     */
    public static boolean isPitOutLap(List<Integer> sector1, List<Integer> sector2, List<Integer> sector3) {
        return isPitLane(sector1) || (isPitLane(sector2) && !isPitLane(sector3));
    }

    public static boolean isDidNotFinish(Double lapDuration) {
        return lapDuration == null;
    }

    public static DecodedLap decodeLap(LapRecord lap) {
        List<DecodedSector> sectors = List.of(
                sector(1, lap.durationSector1(), lap.segmentsSector1()),
                sector(2, lap.durationSector2(), lap.segmentsSector2()),
                sector(3, lap.durationSector3(), lap.segmentsSector3())
        );

        // upstream 이 pit-out 플래그를 주면 segment 패턴보다 우선
        boolean pitOutLap = Boolean.TRUE.equals(lap.pitOutLap())
                || isPitOutLap(lap.segmentsSector1(), lap.segmentsSector2(), lap.segmentsSector3());

        return new DecodedLap(
                lap.meetingKey(),
                lap.sessionKey(),
                lap.driverNumber(),
                lap.lapNumber(),
                lap.dateStart(),
                lap.lapDuration(),
                sectors,
                lap.i1Speed(),
                lap.i2Speed(),
                lap.stSpeed(),
                pitOutLap,
                isPitLane(lap.segmentsSector1(), lap.segmentsSector2(), lap.segmentsSector3()),
                isDidNotFinish(lap.lapDuration())
        );
    }

    public static DecodedCarSample decodeCarSample(CarDataRecord sample) {
        return new DecodedCarSample(
                sample.meetingKey(),
                sample.sessionKey(),
                sample.driverNumber(),
                sample.date(),
                sample.speed(),
                sample.rpm(),
                sample.gear(),
                sample.throttle(),
                sample.brake(),
                sample.drs(),
                decodeDrs(sample.drs())
        );
    }

    public static DecodedDriver decodeDriver(DriverRecord driver) {
        return new DecodedDriver(
                driver.driverNumber(),
                driver.nameAcronym(),
                driver.fullName(),
                driver.teamName(),
                driver.teamColour(),
                driver.countryCode(),
                driver.headshotUrl(),
                driver.sessionKey(),
                driver.meetingKey()
        );
    }

    private static DecodedSector sector(int index, Double duration, List<Integer> segments) {
        return new DecodedSector(index, duration, decodeSegments(segments), sectorPerformance(segments));
    }
}
