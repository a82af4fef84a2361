package io.github.drompincen.dispatchguard.persistence.repository;

import io.github.drompincen.dispatchguard.persistence.document.ContractDocument;
import io.github.drompincen.dispatchguard.protocol.api.AuditScope;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;

public class ContractRepositoryCustomImpl implements ContractRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    public ContractRepositoryCustomImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public List<ContractDocument> findInScope(AuditScope scope) {
        Query query = new Query();
        if (scope != null) {
            if (scope.periodStart() != null) {
                query.addCriteria(Criteria.where("dispatchStartDate").gte(scope.periodStart()));
            }
            if (scope.periodEnd() != null) {
                query.addCriteria(Criteria.where("dispatchEndDate").lte(scope.periodEnd()));
            }
            if (scope.worksiteId() != null) {
                query.addCriteria(Criteria.where("worksiteId").is(scope.worksiteId()));
            }
            if (scope.contractStatus() != null) {
                query.addCriteria(Criteria.where("status").is(scope.contractStatus()));
            }
        }
        query.with(Sort.by(Sort.Direction.ASC, "contractNumber", "_id"));
        return mongoTemplate.find(query, ContractDocument.class);
    }
}
