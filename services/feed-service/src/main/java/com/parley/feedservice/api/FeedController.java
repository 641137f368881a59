package com.parley.feedservice.api;

import com.parley.feedmodel.Group;
import com.parley.feedmodel.Message;
import com.parley.feedservice.domain.GroupService;
import com.parley.feedservice.domain.MessageService;
import com.parley.feedservice.infrastructure.web.IdentityResolver;
import com.parley.pagination.Connection;
import com.parley.pagination.WindowSpec;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Groups and their message history.
 *
 * <pre>
 * GET  /api/v1/groups                          caller's groups
 * POST /api/v1/groups                          create a group
 * GET  /api/v1/groups/{id}/messages?first&amp;after  one page, newest first
 * GET  /api/v1/groups/{id}/messages?last&amp;before  one page toward the newest
 * POST /api/v1/groups/{id}/messages            post a message
 * PATCH  /api/v1/groups/{id}                   rename a group
 * DELETE /api/v1/groups/{id}/members/me        leave a group
 * DELETE /api/v1/groups/{id}                   delete a group (creator only)
 * </pre>
 *
 * <p>History requests may name the flags to compute with {@code pageInfo=hasNextPage,hasPreviousPage};
 * both are computed when the parameter is absent.
 */
@RestController
@RequestMapping("/api/v1/groups")
public class FeedController {

    private final MessageService messages;
    private final GroupService groups;
    private final IdentityResolver identities;

    public FeedController(MessageService messages, GroupService groups, IdentityResolver identities) {
        this.messages = messages;
        this.groups = groups;
        this.identities = identities;
    }

    @GetMapping
    public List<Group> myGroups(HttpServletRequest request) {
        return groups.groupsOf(identities.resolve(request));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Group createGroup(@Valid @RequestBody CreateGroupRequest body, HttpServletRequest request) {
        return groups.create(identities.resolve(request), body.name(), body.memberIds());
    }

    @PatchMapping("/{groupId}")
    public Group renameGroup(
            @PathVariable long groupId,
            @Valid @RequestBody UpdateGroupRequest body,
            HttpServletRequest request) {
        return groups.rename(identities.resolve(request), groupId, body.name());
    }

    @DeleteMapping("/{groupId}/members/me")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void leaveGroup(@PathVariable long groupId, HttpServletRequest request) {
        groups.leave(identities.resolve(request), groupId);
    }

    @DeleteMapping("/{groupId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteGroup(@PathVariable long groupId, HttpServletRequest request) {
        groups.delete(identities.resolve(request), groupId);
    }

    @GetMapping("/{groupId}/messages")
    public MessagePage messages(
            @PathVariable long groupId,
            @RequestParam(required = false) Integer first,
            @RequestParam(required = false) String after,
            @RequestParam(required = false) Integer last,
            @RequestParam(required = false) String before,
            @RequestParam(name = "pageInfo", required = false) List<String> pageInfo,
            HttpServletRequest request) {
        Connection<Message> page = messages.page(
                identities.resolve(request), groupId, new WindowSpec(first, after, last, before));
        // Flags are resolved before serialization so a store failure maps to 503.
        return MessagePage.of(page, pageInfo == null ? MessagePage.ALL_FLAGS : pageInfo);
    }

    @PostMapping("/{groupId}/messages")
    @ResponseStatus(HttpStatus.CREATED)
    public Message postMessage(
            @PathVariable long groupId,
            @Valid @RequestBody PostMessageRequest body,
            HttpServletRequest request) {
        return messages.post(identities.resolve(request), groupId, body.text());
    }
}
