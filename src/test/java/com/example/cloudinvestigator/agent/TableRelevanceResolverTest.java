package com.example.cloudinvestigator.agent;

import com.example.cloudinvestigator.domain.Provider;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TableRelevanceResolverTest {

    private final TableRelevanceResolver resolver = new TableRelevanceResolver();

    @Test
    void findsEc2TableAndAccountRoot() {
        Set<String> tables = resolver.resolve("Find all running EC2 instances", Provider.AWS);

        assertTrue(tables.containsAll(Set.of("aws_ec2_instance", "aws_account")));
    }

    @Test
    void fallsBackToRootTableOnly() {
        assertEquals(Set.of("aws_account"), resolver.resolve("hello there", Provider.AWS));
        assertEquals(Set.of("gcp_project"), resolver.resolve("", Provider.GCP));
    }

    @Test
    void unionsEveryMatchingGroupWithRootLast() {
        List<String> tables = new ArrayList<>(resolver.resolve("Which S3 buckets can IAM users read?", Provider.AWS));

        assertTrue(tables.containsAll(List.of("aws_s3_bucket", "aws_iam_user", "aws_iam_role")));
        assertEquals("aws_account", tables.get(tables.size() - 1));
    }

    @Test
    void usesProviderSpecificGroups() {
        Set<String> tables = resolver.resolve("List every Virtual Machine", Provider.AZURE);

        assertEquals(List.of("azure_compute_virtual_machine", "azure_subscription"), new ArrayList<>(tables));
    }

    @Test
    void isDeterministic() {
        String prompt = "public buckets, open ports and lambda functions";
        assertEquals(new ArrayList<>(resolver.resolve(prompt, Provider.AWS)),
                new ArrayList<>(resolver.resolve(prompt, Provider.AWS)));
    }
}
