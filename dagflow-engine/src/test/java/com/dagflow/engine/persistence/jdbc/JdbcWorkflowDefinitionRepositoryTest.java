package com.dagflow.engine.persistence.jdbc;

import com.dagflow.core.repository.WorkflowDefinitionRepository;
import com.dagflow.engine.persistence.WorkflowDefinitionRepositoryContractTest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;

class JdbcWorkflowDefinitionRepositoryTest extends WorkflowDefinitionRepositoryContractTest {

    @Override
    protected WorkflowDefinitionRepository createRepository() {
        return new JdbcWorkflowDefinitionRepository(new JdbcTemplate(H2Database.create()), new ObjectMapper());
    }
}
