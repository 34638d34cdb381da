package kr.hospital.triage.infrastructure.config;

import kr.hospital.triage.domain.session.TriageSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class TriageSessionConfig {

    @Bean
    public TriageSession triageSession(TriageConfig triageConfig) {
        Integer capacity = triageConfig.getCapacity();
        TriageSession session = TriageSession.withCapacity(capacity);

        log.info("접수 창구 초기화 - 최대 수용 인원: {}", capacity != null ? capacity : "무제한");
        return session;
    }
}
