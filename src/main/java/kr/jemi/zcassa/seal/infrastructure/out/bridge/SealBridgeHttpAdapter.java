package kr.jemi.zcassa.seal.infrastructure.out.bridge;

import kr.jemi.zcassa.seal.api.SealException;
import kr.jemi.zcassa.seal.api.SealFailure;
import kr.jemi.zcassa.seal.application.port.out.SealDevicePort;
import kr.jemi.zcassa.seal.domain.DeviceSeal;
import kr.jemi.zcassa.seal.infrastructure.out.bridge.dto.BridgeSealRequest;
import kr.jemi.zcassa.seal.infrastructure.out.bridge.dto.BridgeSealResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Duration;
import java.time.LocalDateTime;

@Component
public class SealBridgeHttpAdapter implements SealDevicePort {

    private static final Logger log = LoggerFactory.getLogger(SealBridgeHttpAdapter.class);
    private static final String CARD_NOT_READY = "CARD_NOT_READY";

    private final RestClient restClient;

    public SealBridgeHttpAdapter(RestClient.Builder restClientBuilder,
                                 @Value("${zcassa.seal.bridge.url}") String bridgeUrl,
                                 @Value("${zcassa.seal.bridge.connect-timeout}") Duration connectTimeout,
                                 @Value("${zcassa.seal.bridge.read-timeout}") Duration readTimeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);
        this.restClient = restClientBuilder
                .baseUrl(bridgeUrl)
                .requestFactory(requestFactory)
                .build();
    }

    @Override
    public DeviceSeal seal(long priceMinorUnits) {
        BridgeSealResponse response;
        try {
            response = restClient.post()
                    .uri("/seals")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new BridgeSealRequest(priceMinorUnits))
                    .retrieve()
                    .body(BridgeSealResponse.class);
        } catch (RestClientException e) {
            log.warn("봉인 브리지 호출 실패: price={}, cause={}", priceMinorUnits, e.getMessage());
            throw new SealException(SealFailure.DEVICE_ERROR, "봉인 브리지 호출 실패: " + e.getMessage(), e);
        }

        if (response == null || !response.success()) {
            String error = response != null ? response.error() : "빈 응답";
            SealFailure failure = response != null && CARD_NOT_READY.equals(response.errorCode())
                    ? SealFailure.CARD_NOT_READY
                    : SealFailure.DEVICE_ERROR;
            throw new SealException(failure, "봉인 장치 오류: " + error);
        }
        if (response.sealCode() == null || response.counter() == null) {
            throw new SealException(SealFailure.DEVICE_ERROR, "봉인 장치 응답에 봉인 값이 없습니다");
        }
        return new DeviceSeal(response.counter(), response.sealCode(), response.serialNumber(), response.mac(),
                response.sealedAt() != null ? response.sealedAt() : LocalDateTime.now());
    }
}
