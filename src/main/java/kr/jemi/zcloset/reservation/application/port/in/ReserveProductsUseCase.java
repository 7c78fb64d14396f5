package kr.jemi.zcloset.reservation.application.port.in;

import kr.jemi.zcloset.reservation.domain.ReserveOutcome;

import java.util.Collection;

public interface ReserveProductsUseCase {

    ReserveOutcome reserve(Collection<String> productIds, String holderId);
}
