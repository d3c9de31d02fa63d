package eu.virtualparadox.pdfrag;

import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class PdfRagApplication {

    public static void main(final String[] args) {
        new SpringApplicationBuilder(PdfRagApplication.class)
                .web(WebApplicationType.NONE)
                .run(args);
    }
}
