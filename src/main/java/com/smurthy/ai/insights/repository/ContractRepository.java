package com.smurthy.ai.insights.repository;

import com.smurthy.ai.insights.model.ContractTemplate;

import java.util.List;
import java.util.Optional;

public interface ContractRepository {

    List<ContractTemplate> findAllTemplates();

    Optional<ContractTemplate> findTemplate(String templateId);
}
