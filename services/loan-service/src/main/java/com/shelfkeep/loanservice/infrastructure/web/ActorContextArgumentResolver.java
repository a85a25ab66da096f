package com.shelfkeep.loanservice.infrastructure.web;

import com.shelfkeep.observability.CorrelationContextHolder;
import com.shelfkeep.security.ActorContext;
import com.shelfkeep.security.ActorContextSerializer;
import com.shelfkeep.security.ActorContextSerializer.ActorSerializationException;
import com.shelfkeep.security.ActorContextValidator;
import com.shelfkeep.security.SecurityValidationResult;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Resolves {@link ActorContext} controller parameters from the {@value
 * ActorContextSerializer#HEADER} header set by the authorization layer.
 *
 * <p>A missing, undecodable or incomplete actor raises {@link UnauthenticatedActorException}. A
 * resolved actor is added to the current correlation context so logs and metrics carry its
 * tenant and member id.
 */
public class ActorContextArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return ActorContext.class.equals(parameter.getParameterType());
    }

    @Override
    public ActorContext resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        String header = webRequest.getHeader(ActorContextSerializer.HEADER);
        if (header == null || header.isBlank()) {
            throw new UnauthenticatedActorException(
                    "Missing " + ActorContextSerializer.HEADER + " header");
        }

        ActorContext actor;
        try {
            actor = ActorContextSerializer.deserialize(header);
        } catch (ActorSerializationException e) {
            throw new UnauthenticatedActorException("Malformed actor context", e);
        }

        SecurityValidationResult validation = ActorContextValidator.validate(actor);
        if (!validation.valid()) {
            throw new UnauthenticatedActorException(
                    "Invalid actor context: " + String.join("; ", validation.errors()));
        }

        CorrelationContextHolder.bindActor(actor.tenantId(), actor.memberId());
        return actor;
    }
}
