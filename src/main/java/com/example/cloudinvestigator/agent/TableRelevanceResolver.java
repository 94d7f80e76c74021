package com.example.cloudinvestigator.agent;

import com.example.cloudinvestigator.domain.Provider;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Picks the candidate tables a prompt is likely about.
 * <p>
 * Every keyword group that matches contributes its tables. The provider's
 * root table is always included, so the result is never empty.
 */
@Component
public class TableRelevanceResolver {

    private static final Map<Provider, List<KeywordGroup>> GROUPS = Map.of(
            Provider.AWS, List.of(
                    group(List.of("instance", "ec2", "server", "compute"), "aws_ec2_instance"),
                    group(List.of("security", "firewall", "0.0.0.0", "port"), "aws_vpc_security_group"),
                    group(List.of("bucket", "s3", "storage"), "aws_s3_bucket"),
                    group(List.of("user", "role", "iam", "permission", "policy"), "aws_iam_user", "aws_iam_role"),
                    group(List.of("lambda", "function", "serverless"), "aws_lambda_function"),
                    group(List.of("database", "rds", "mysql", "postgres"), "aws_rds_db_instance"),
                    group(List.of("vpc", "network", "subnet"), "aws_vpc"),
                    group(List.of("volume", "ebs", "disk"), "aws_ebs_volume")),
            Provider.AZURE, List.of(
                    group(List.of("vm", "virtual machine", "compute"), "azure_compute_virtual_machine"),
                    group(List.of("storage", "blob"), "azure_storage_account"),
                    group(List.of("security", "nsg", "firewall", "port"), "azure_network_security_group"),
                    group(List.of("database", "sql"), "azure_sql_server"),
                    group(List.of("user", "role", "identity", "permission"), "azure_ad_user", "azure_role_assignment")),
            Provider.GCP, List.of(
                    group(List.of("instance", "compute", "gce", "vm"), "gcp_compute_instance"),
                    group(List.of("storage", "bucket", "gcs"), "gcp_storage_bucket"),
                    group(List.of("firewall", "security", "port"), "gcp_compute_firewall"),
                    group(List.of("database", "sql"), "gcp_sql_database_instance"),
                    group(List.of("iam", "service account", "permission", "role"), "gcp_service_account")));

    public Set<String> resolve(String prompt, Provider provider) {
        Set<String> tables = new LinkedHashSet<>();
        String lower = prompt != null ? prompt.toLowerCase(Locale.ROOT) : "";
        for (KeywordGroup group : GROUPS.getOrDefault(provider, List.of())) {
            if (group.keywords().stream().anyMatch(lower::contains)) {
                tables.addAll(group.tables());
            }
        }
        tables.add(provider.getRootTable());
        return tables;
    }

    private static KeywordGroup group(List<String> keywords, String... tables) {
        return new KeywordGroup(keywords, List.of(tables));
    }

    private record KeywordGroup(List<String> keywords, List<String> tables) {}
}
