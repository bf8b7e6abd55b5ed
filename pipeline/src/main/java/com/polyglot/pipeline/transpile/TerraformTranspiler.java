package com.polyglot.pipeline.transpile;

import com.polyglot.pipeline.classify.Artifact;
import com.polyglot.pipeline.classify.ArtifactType;
import com.polyglot.pipeline.classify.MetadataExtractor;
import com.polyglot.pipeline.classify.Polyglot;

import java.util.List;
import java.util.stream.Collectors;

final class TerraformTranspiler {

    private TerraformTranspiler() {}

    static Transpilation transpile(Polyglot polyglot) {
        List<Artifact> blocks = polyglot.artifactsOf(ArtifactType.TERRAFORM);
        if (blocks.isEmpty()) {
            return Transpilation.Failure.missing(Target.TERRAFORM, ArtifactType.TERRAFORM);
        }
        String configuration = blocks.stream()
                .map(a -> a.content().strip())
                .collect(Collectors.joining("\n\n", "", "\n"));
        return new Transpilation.Success(new TranspiledConfig.TerraformConfig(
                configuration,
                polyglot.metadataMap(MetadataExtractor.TERRAFORM_VARS),
                "terraform plan -var-file=terraform.tfvars.json",
                "terraform apply -auto-approve -var-file=terraform.tfvars.json"));
    }
}
