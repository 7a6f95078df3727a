package uk.gegc.questionbot.features.chat.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.questionbot.features.chat.api.dto.ChatDocumentDto;
import uk.gegc.questionbot.features.chat.api.dto.ChatReplyDto;
import uk.gegc.questionbot.features.chat.api.dto.OutboundMessageDto;
import uk.gegc.questionbot.features.chat.api.dto.ReplyButtonDto;
import uk.gegc.questionbot.features.chat.domain.ChatDocument;
import uk.gegc.questionbot.features.chat.domain.ChatReply;
import uk.gegc.questionbot.features.chat.domain.OutboundMessage;
import uk.gegc.questionbot.features.chat.domain.ReplyButton;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface ChatReplyMapper {

    ChatReplyDto toDto(ChatReply reply);

    OutboundMessageDto toDto(OutboundMessage message);

    List<OutboundMessageDto> toMessageDtos(List<OutboundMessage> messages);

    ReplyButtonDto toDto(ReplyButton button);

    List<ReplyButtonDto> toButtonDtos(List<ReplyButton> buttons);

    ChatDocumentDto toDto(ChatDocument document);
}
