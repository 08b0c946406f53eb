package com.example.LlmCouncil;

import com.example.LlmCouncil.repository.ExchangeStore;
import com.example.LlmCouncil.repository.InMemoryExchangeStore;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
        properties = {
                "spring.ai.model.chat=none",
                "spring.ai.openai.api-key=test",
                "spring.ai.deepseek.api-key=test",
                "spring.datasource.url=jdbc:h2:mem:testdb;DB_CLOSE_DELAY=-1;MODE=PostgreSQL",
                "spring.datasource.driver-class-name=org.h2.Driver",
                "spring.datasource.username=sa",
                "spring.datasource.password=",
                "spring.sql.init.mode=never",
                "council.store=memory"
        }
)
@ActiveProfiles("test")
@Import(LlmCouncilApplicationTests.TestAiConfiguration.class)
class LlmCouncilApplicationTests {

    @Autowired
    private ExchangeStore exchangeStore;

    @Test
    void contextLoads() {
        assertThat(exchangeStore).isInstanceOf(InMemoryExchangeStore.class);
    }

    @TestConfiguration
    static class TestAiConfiguration {
        @Bean
        OpenAiChatModel openAiChatModel() {
            return Mockito.mock(OpenAiChatModel.class);
        }
    }
}
