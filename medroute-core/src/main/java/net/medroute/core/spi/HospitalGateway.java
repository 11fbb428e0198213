package net.medroute.core.spi;

import net.medroute.core.model.AdmissionOutcome;
import net.medroute.core.model.PatientRequest;
import net.medroute.core.model.ResourceSnapshot;

import java.time.Duration;
import java.util.Optional;

/** 병원과의 요청/응답 교환. empty = 타임아웃(응답 없음) */
public interface HospitalGateway {
    Optional<ResourceSnapshot> queryResources(String hospital, Duration timeout) throws Exception;

    Optional<AdmissionOutcome> requestAdmission(String hospital, PatientRequest request, Duration timeout) throws Exception;

    Optional<AdmissionOutcome> requestTransfer(String hospital, PatientRequest request, Duration timeout) throws Exception;
}
