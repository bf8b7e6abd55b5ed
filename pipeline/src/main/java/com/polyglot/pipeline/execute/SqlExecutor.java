package com.polyglot.pipeline.execute;

import com.polyglot.pipeline.classify.Language;
import com.polyglot.pipeline.classify.Polyglot;
import com.polyglot.pipeline.transpile.Target;
import com.polyglot.pipeline.transpile.TranspiledConfig.SqlConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Runs each statement through its own {@code psql -c}. */
@Component
public class SqlExecutor extends ToolExecutor<SqlConfig> {

    private static final int PREVIEW = 50;

    private final String defaultDatabase;

    public SqlExecutor(ProcessRunner runner,
                       Workspaces workspaces,
                       @Value("${polyglot.sql.database-url:postgres://localhost/polyglot_db}") String defaultDatabase) {
        super(runner, workspaces, SqlConfig.class);
        this.defaultDatabase = defaultDatabase;
    }

    @Override public Language language() { return Language.SQL; }
    @Override protected Target target()  { return Target.SQL; }

    @Override
    protected ExecutionResult run(SqlConfig config, Polyglot polyglot) {
        String database = config.database() != null ? config.database() : defaultDatabase;

        Optional<Path> psql = runner.locate("psql");
        if (psql.isEmpty()) {
            List<UnitResult> units = config.statements().stream()
                    .map(s -> new UnitResult(preview(s), true, 0, "psql not installed - would execute: " + preview(s)))
                    .toList();
            log.warn("psql not found on search path, returning mock result");
            return ExecutionResult.mock(language(), batch(units, Map.of("database", database)).details());
        }

        try (Workspace ws = workspaces.acquire("sql")) {
            List<UnitResult> units = new ArrayList<>();
            for (String statement : config.statements()) {
                Command cmd = Command.of(ws.dir(), psql.get().toString(),
                        database, "-v", "ON_ERROR_STOP=1", "-X", "-q", "-c", statement);
                units.add(UnitResult.of(preview(statement), runner.run(cmd)));
            }
            Map<String, Object> extra = new LinkedHashMap<>();
            extra.put("database", database);
            return batch(units, extra);
        }
    }

    static String preview(String statement) {
        String flat = statement.replaceAll("\\s+", " ").strip();
        return flat.length() <= PREVIEW ? flat : flat.substring(0, PREVIEW) + "...";
    }
}
