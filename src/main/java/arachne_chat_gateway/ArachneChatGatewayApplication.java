package arachne_chat_gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

@SpringBootApplication
@EnableRetry
public class ArachneChatGatewayApplication {

	public static void main(String[] args) {
		SpringApplication.run(ArachneChatGatewayApplication.class, args);
	}

}
