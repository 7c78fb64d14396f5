package kr.jemi.zcloset.checkout.application.port.in;

import kr.jemi.zcloset.checkout.domain.PaymentOutcome;

public interface CompletePaymentUseCase {

    void complete(String reference, String holderId, PaymentOutcome outcome);
}
