package eu.virtualparadox.pdfrag.application.config;

import eu.virtualparadox.pdfrag.application.executor.BoundedCallExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    /**
     * Pool for bounded embedding and vector-store calls. Timed-out calls keep their thread
     * until the backend returns, so the pool is sized above the number of concurrent ingestions.
     */
    @Bean
    public BoundedCallExecutor backendCallExecutor() {
        return BoundedCallExecutor.create("backend-call-", 8);
    }
}
