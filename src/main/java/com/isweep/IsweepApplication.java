package com.isweep;

import com.isweep.dispatch.cli.CliRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Boots ISweep either as the HTTP decision service ({@code isweep serve}) or
 * as a one-shot CLI that exits with the command's status.
 */
// DataSource comes from PreferencesStoreConfig, only when isweep.store.jdbc-url is non-blank
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class IsweepApplication {

    public static void main(String[] args) {
        String[] effectiveArgs = withDefaultCommand(args, System.getenv("PORT"));
        boolean serve = CliRunner.isServeCommand(effectiveArgs);

        ConfigurableApplicationContext ctx = new SpringApplicationBuilder(IsweepApplication.class)
                .web(serve ? WebApplicationType.SERVLET : WebApplicationType.NONE)
                .properties("spring.main.banner-mode=off")
                .run(effectiveArgs);

        if (!serve) {
            System.exit(SpringApplication.exit(ctx, ctx.getBean(ExitCodeGenerator.class)));
        }
    }

    /**
     * Container platforms set {@code PORT} and start the jar without arguments;
     * that launch means serve.
     */
    static String[] withDefaultCommand(String[] args, String portEnv) {
        if (args.length == 0 && portEnv != null) {
            return new String[]{"serve"};
        }
        return args;
    }
}
