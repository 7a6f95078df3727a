package uk.gegc.questionbot.features.account.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;
import uk.gegc.questionbot.features.account.api.dto.BalanceDto;
import uk.gegc.questionbot.features.account.domain.model.Account;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface AccountMapper {

    @Mapping(target = "accountId", source = "id")
    BalanceDto toBalanceDto(Account account);
}
