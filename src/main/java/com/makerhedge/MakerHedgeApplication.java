package com.makerhedge;

import com.makerhedge.exception.BaseException;
import org.springframework.boot.ExitCodeExceptionMapper;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableAsync
@EnableScheduling
public class MakerHedgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(MakerHedgeApplication.class, args);
    }

    /** Startup failures exit with the status of their error code. */
    @Bean
    public ExitCodeExceptionMapper exitCodeExceptionMapper() {
        return exception -> {
            Throwable cause = exception;
            while (cause != null) {
                if (cause instanceof BaseException) {
                    return ((BaseException) cause).getErrorCode().getExitStatus();
                }
                cause = cause.getCause();
            }
            return 1;
        };
    }
}
