package com.polyglot.pipeline.transpile;

import com.polyglot.pipeline.classify.ArtifactType;
import com.polyglot.pipeline.classify.PolyglotParser;
import com.polyglot.pipeline.transpile.TranspiledConfig.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Each transpiler is a pure function of the parsed document.
 */
class TranspilersTest {

    // ------------------------------------------------------------------
    // Dispatch
    // ------------------------------------------------------------------

    @ParameterizedTest
    @EnumSource(Target.class)
    void transpile_plainDocument_failsWithMissingArtifactForEveryTarget(Target target) {
        Transpilation result = Transpilers.transpile(PolyglotParser.parse("# nothing here"), target);

        assertThat(result).isInstanceOf(Transpilation.Failure.class);
        assertThat(((Transpilation.Failure) result).target()).isEqualTo(target);
    }

    @Test
    void fromWireName_isCaseInsensitive() {
        assertThat(Target.fromWireName("Kubernetes")).contains(Target.KUBERNETES);
        assertThat(Target.fromWireName("helm")).isEmpty();
        assertThat(Target.fromWireName(null)).isEmpty();
    }

    // ------------------------------------------------------------------
    // Per target
    // ------------------------------------------------------------------

    @Test
    void docker_usesFirstDockerfileAndImageDirective() {
        DockerConfig config = success(Target.DOCKER, """
                <!-- polyglot:image=shop/api:1.2 -->
                ```dockerfile
                FROM alpine
                ```
                ```dockerfile
                FROM scratch
                ```
                """, DockerConfig.class);

        assertThat(config.dockerfile()).isEqualTo("FROM alpine");
        assertThat(config.image()).isEqualTo("shop/api:1.2");
        assertThat(config.buildCommand()).contains("-t shop/api:1.2");
    }

    @Test
    void docker_defaultsImageTag() {
        DockerConfig config = success(Target.DOCKER, "```dockerfile\nFROM alpine\n```", DockerConfig.class);

        assertThat(config.image()).isEqualTo("polyglot:latest");
    }

    @Test
    void terraform_joinsBlocksAndCarriesVariables() {
        TerraformConfig config = success(Target.TERRAFORM, """
                <!-- polyglot:tfvars region=eu-west-1 size=small -->
                ```terraform
                variable "region" {}
                ```
                ```hcl
                variable "size" {}
                ```
                """, TerraformConfig.class);

        assertThat(config.configuration()).isEqualTo("variable \"region\" {}\n\nvariable \"size\" {}\n");
        assertThat(config.variables()).isEqualTo(Map.of("region", "eu-west-1", "size", "small"));
        assertThat(config.planCommand()).startsWith("terraform plan");
    }

    @Test
    void kubernetes_oneManifestPerBlockAndNamespaceFromFirst() {
        KubernetesConfig config = success(Target.KUBERNETES, """
                ```yaml
                apiVersion: v1
                kind: ConfigMap
                metadata:
                  name: cfg
                  namespace: shop
                ```
                ```yaml
                apiVersion: v1
                kind: Service
                metadata:
                  name: web
                ```
                """, KubernetesConfig.class);

        assertThat(config.manifests()).hasSize(2);
        assertThat(config.manifests().get(1)).contains("kind: Service");
        assertThat(config.namespace()).isEqualTo("shop");
    }

    @Test
    void kubernetes_defaultNamespace() {
        KubernetesConfig config = success(Target.KUBERNETES,
                "```yaml\napiVersion: v1\nkind: Pod\nmetadata:\n  name: p\n```", KubernetesConfig.class);

        assertThat(config.namespace()).isEqualTo("default");
    }

    @Test
    void git_filesInOrderAndQuotedCommitMessage() {
        GitConfig config = success(Target.GIT, """
                <!-- polyglot:commit_message="it's alive" -->
                ```file:README.md
                # Hi
                ```
                ```file:src/app.sh
                echo app
                ```
                """, GitConfig.class);

        assertThat(config.files()).containsExactly(
                Map.entry("README.md", "# Hi\n"),
                Map.entry("src/app.sh", "echo app\n"));
        assertThat(config.initCommands()).hasSize(3);
        assertThat(config.initCommands().get(0)).startsWith("git init");
        assertThat(config.initCommands().get(2))
                .contains("-c user.name='Polyglot'")
                .endsWith("commit -q -m 'it'\\''s alive'");
    }

    @Test
    void bash_joinsScriptsAndCarriesEnvironment() {
        BashConfig config = success(Target.BASH, """
                <!-- polyglot:executable -->
                <!-- polyglot:env GREETING=hello -->
                ```bash
                #!/bin/bash
                echo "$GREETING"
                ```
                ```sh
                echo second
                ```
                """, BashConfig.class);

        assertThat(config.script()).isEqualTo("#!/bin/bash\necho \"$GREETING\"\n\necho second");
        assertThat(config.shebang()).isEqualTo("#!/bin/bash");
        assertThat(config.environment()).containsEntry("GREETING", "hello");
    }

    @Test
    void bash_withoutShebang_reportsDefaultInterpreterButLeavesScriptAlone() {
        BashConfig config = success(Target.BASH, """
                <!-- polyglot:executable -->
                ```bash
                false
                echo after
                ```
                """, BashConfig.class);

        assertThat(config.script()).isEqualTo("false\necho after");
        assertThat(config.shebang()).isEqualTo("#!/usr/bin/env bash");
    }

    @Test
    void sql_splitsStatementsAndPicksDatabase() {
        SqlConfig config = success(Target.SQL, """
                <!-- polyglot:database=postgres://db/app -->
                ```sql
                CREATE TABLE t (v text);
                INSERT INTO t VALUES ('a;b');
                ```
                """, SqlConfig.class);

        assertThat(config.statements()).containsExactly(
                "CREATE TABLE t (v text)",
                "INSERT INTO t VALUES ('a;b')");
        assertThat(config.database()).isEqualTo("postgres://db/app");
    }

    @Test
    void failure_namesMissingArtifactType() {
        Transpilation result = Transpilers.transpile(PolyglotParser.parse("```sql\nSELECT 1\n```"), Target.DOCKER);

        Transpilation.Failure failure = (Transpilation.Failure) result;
        assertThat(failure.missing()).isEqualTo(ArtifactType.DOCKERFILE);
        assertThat(failure.message()).contains("dockerfile");
        assertThat(result.isSuccess()).isFalse();
    }

    // ------------------------------------------------------------------
    // SQL splitting
    // ------------------------------------------------------------------

    @Test
    void split_ignoresSemicolonsInQuotesAndComments() {
        List<String> statements = SqlTranspiler.split("""
                -- setup; not a split
                SELECT 'x;y', "odd;name" FROM t; /* a;b */ SELECT 2;
                SELECT 'it''s;fine'
                """);

        assertThat(statements).containsExactly(
                "-- setup; not a split\nSELECT 'x;y', \"odd;name\" FROM t",
                "/* a;b */ SELECT 2",
                "SELECT 'it''s;fine'");
    }

    @Test
    void split_dropsEmptyAndCommentOnlySegments() {
        assertThat(SqlTranspiler.split(";;  ;\n-- trailing comment\n")).isEmpty();
    }

    private static <C extends TranspiledConfig> C success(Target target, String markdown, Class<C> type) {
        Transpilation result = Transpilers.transpile(PolyglotParser.parse(markdown), target);
        assertThat(result).isInstanceOf(Transpilation.Success.class);
        return type.cast(((Transpilation.Success) result).config());
    }
}
