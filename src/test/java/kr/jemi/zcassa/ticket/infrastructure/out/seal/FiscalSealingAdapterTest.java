package kr.jemi.zcassa.ticket.infrastructure.out.seal;

import kr.jemi.zcassa.common.exception.ErrorCode;
import kr.jemi.zcassa.seal.api.CardStatus;
import kr.jemi.zcassa.seal.api.FiscalSealFacade;
import kr.jemi.zcassa.seal.api.SealException;
import kr.jemi.zcassa.seal.api.SealFailure;
import kr.jemi.zcassa.seal.api.SealReceipt;
import kr.jemi.zcassa.ticket.domain.DeviceReadiness;
import kr.jemi.zcassa.ticket.domain.SealStamp;
import kr.jemi.zcassa.ticket.domain.SealingFailedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
class FiscalSealingAdapterTest {

    @Mock
    private FiscalSealFacade fiscalSealFacade;

    private FiscalSealingAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new FiscalSealingAdapter(fiscalSealFacade);
    }

    @Nested
    @DisplayName("장치 준비 상태 확인")
    class CheckReadiness {

        @Test
        @DisplayName("브리지가 연결되지 않았으면 BRIDGE_NOT_CONNECTED")
        void shouldReportBridgeNotConnected() {
            // given
            given(fiscalSealFacade.isDeviceConnected()).willReturn(false);

            // when
            DeviceReadiness readiness = adapter.checkReadiness();

            // then
            assertThat(readiness.isReady()).isFalse();
            assertThat(readiness.errorCode()).isEqualTo(ErrorCode.BRIDGE_NOT_CONNECTED);
            then(fiscalSealFacade).should(never()).cardStatus();
        }

        @Test
        @DisplayName("카드가 준비되지 않았으면 CARD_NOT_READY 와 카드 오류 메시지")
        void shouldReportCardNotReady() {
            // given
            given(fiscalSealFacade.isDeviceConnected()).willReturn(true);
            given(fiscalSealFacade.cardStatus()).willReturn(CardStatus.notReady("카드 미삽입"));

            // when
            DeviceReadiness readiness = adapter.checkReadiness();

            // then
            assertThat(readiness.isReady()).isFalse();
            assertThat(readiness.errorCode()).isEqualTo(ErrorCode.CARD_NOT_READY);
            assertThat(readiness.message()).isEqualTo("카드 미삽입");
        }

        @Test
        @DisplayName("브리지 연결과 카드 준비가 모두 되었으면 준비 완료")
        void shouldReportReady() {
            // given
            given(fiscalSealFacade.isDeviceConnected()).willReturn(true);
            given(fiscalSealFacade.cardStatus()).willReturn(CardStatus.ok());

            // when
            DeviceReadiness readiness = adapter.checkReadiness();

            // then
            assertThat(readiness.isReady()).isTrue();
        }
    }

    @Nested
    @DisplayName("봉인 요청")
    class Seal {

        @Test
        @DisplayName("발급 봉인 영수증을 티켓 봉인 정보로 옮긴다")
        void shouldMapReceiptToStamp() {
            // given
            given(fiscalSealFacade.requestEmissionSeal(15_000L, 7L)).willReturn(new SealReceipt(
                    99L, 42L, "SEAL-42", "SN-1", "MAC", LocalDateTime.of(2026, 1, 1, 10, 0)));

            // when
            SealStamp stamp = adapter.sealEmission(15_000L, 7L);

            // then
            assertThat(stamp).isEqualTo(new SealStamp(99L, "SEAL-42", 42L));
        }

        @Test
        @DisplayName("장치가 사용 중이면 SEAL_ERROR 로 변환된 예외를 던진다")
        void shouldTranslateDeviceBusy() {
            // given
            given(fiscalSealFacade.requestCancellationSeal(7L))
                    .willThrow(new SealException(SealFailure.DEVICE_BUSY, "봉인 장치 사용 중"));

            // when & then
            assertThatThrownBy(() -> adapter.sealCancellation(7L))
                    .isInstanceOf(SealingFailedException.class)
                    .hasMessage("봉인 장치 사용 중")
                    .extracting(e -> ((SealingFailedException) e).getErrorCode())
                    .isEqualTo(ErrorCode.SEAL_ERROR);
        }
    }
}
