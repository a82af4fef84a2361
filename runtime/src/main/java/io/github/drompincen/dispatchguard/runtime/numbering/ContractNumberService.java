package io.github.drompincen.dispatchguard.runtime.numbering;

import io.github.drompincen.dispatchguard.persistence.document.ContractNumberCounterDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;

/**
 * Issues contract numbers of the form {@code KOB-yyyyMM-NNNN}. The per-month sequence lives in
 * {@code contract_number_counters} and is incremented atomically by the store.
 */
@Service
public class ContractNumberService {

    private static final Logger log = LoggerFactory.getLogger(ContractNumberService.class);
    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyyMM");
    static final String PREFIX = "KOB";

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public ContractNumberService(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
    }

    public String nextContractNumber() {
        return nextContractNumber(YearMonth.now(clock));
    }

    public String nextContractNumber(YearMonth month) {
        String key = MONTH.format(month);
        Query query = new Query(Criteria.where("_id").is(key));
        Update update = new Update()
                .inc("lastSequence", 1)
                .set("updatedAt", clock.instant());

        ContractNumberCounterDocument counter = mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true).upsert(true),
                ContractNumberCounterDocument.class);
        if (counter == null) {
            throw new IllegalStateException("Counter upsert returned nothing for " + key);
        }

        String number = String.format("%s-%s-%04d", PREFIX, key, counter.getLastSequence());
        log.debug("Issued contract number {}", number);
        return number;
    }
}
