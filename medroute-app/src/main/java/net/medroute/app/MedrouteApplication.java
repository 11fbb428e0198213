package net.medroute.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MedrouteApplication {

    // 시뮬레이션은 유한하므로 러너가 끝나면 컨텍스트를 닫고 종료
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(MedrouteApplication.class, args)));
    }
}
