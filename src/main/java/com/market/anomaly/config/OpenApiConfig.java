package com.market.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI marketAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Market Anomaly API")
                        .version("1.0.0")
                        .description(
                                "Streaming anomaly detection over market indicators.\n\n" +
                                "**Tick Pipeline:**\n" +
                                "1. Receive a tick of samples via `POST /api/v1/ticks`\n" +
                                "2. Append samples to per-(instrument, metric) rolling windows (30 minutes)\n" +
                                "3. Evaluate the six anomaly rules per instrument, edge-triggered\n" +
                                "4. Fold events into the sentiment score (0-100, mean-reverting to 50)\n" +
                                "5. Map score to status: **RED** (>=70), **YELLOW**, **GREEN** (<=30)\n" +
                                "6. Emit notifications: **flash**, **card** or **alert**\n\n" +
                                "**Event Subtypes:**\n" +
                                "- `sentiment_turning_up`: volume spike with rising index and limit-ups\n" +
                                "- `sentiment_turning_down`: falling index with limit-downs and failed limit-ups\n" +
                                "- `flow_withdrawal`: northbound net outflow over 10 minutes\n" +
                                "- `flow_reversal`: northbound flow trend turns positive and holds\n" +
                                "- `theme_emergence`: new sectors in the top 3 with sector volume spike\n" +
                                "- `theme_exhaustion`: leader below VWAP while the sector stalls")
                        .contact(new Contact().name("Market Anomaly Team")));
    }
}
