/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.fireflyframework.webhookguard.web;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the Firefly Webhook Guard.
 * <p>
 * Verifies inbound Typeform webhooks, relays accepted payloads to the configured
 * target and retries failed deliveries in the background.
 */
@SpringBootApplication(scanBasePackages = "org.fireflyframework.webhookguard")
@EnableScheduling
@OpenAPIDefinition(
        info = @Info(
                title = "Firefly Webhook Guard",
                version = "1.0.0",
                description = "Webhook signature verification, outbound rate limiting and delivery retries",
                contact = @Contact(
                        name = "Firefly Platform Team",
                        email = "platform@getfirefly.io"
                )
        ),
        servers = {
                @Server(
                        url = "http://localhost:8080",
                        description = "Local Development Environment"
                )
        }
)
public class WebhookGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(WebhookGuardApplication.class, args);
    }
}
