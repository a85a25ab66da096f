package com.shelfkeep.loanservice.domain.port;

import com.shelfkeep.loanservice.domain.model.Member;
import java.util.Optional;

/** Read access to the roster. */
public interface MemberDirectory {

    Optional<Member> find(String memberId);

    /**
     * Finds the member and holds a write lock on its roster row until the current unit of work
     * ends, serializing concurrent borrows of one member.
     */
    Optional<Member> lockForBorrowing(String memberId);
}
