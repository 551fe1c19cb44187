package io.b2mash.invoiceintake;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class InvoiceIntakeApplication {

  public static void main(String[] args) {
    SpringApplication.run(InvoiceIntakeApplication.class, args);
  }
}
