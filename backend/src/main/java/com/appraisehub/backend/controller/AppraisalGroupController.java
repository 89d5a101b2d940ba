package com.appraisehub.backend.controller;

import com.appraisehub.backend.dto.AddMemberRequest;
import com.appraisehub.backend.dto.GroupDTO;
import com.appraisehub.backend.dto.GroupMemberDTO;
import com.appraisehub.backend.dto.GroupRequest;
import com.appraisehub.backend.dto.GroupUpdateRequest;
import com.appraisehub.backend.security.AppraisalActor;
import com.appraisehub.backend.service.AppraisalGroupService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/appraisal-groups")
@RequiredArgsConstructor
@PreAuthorize("hasAnyRole('HR_MANAGER', 'ADMIN', 'SUPER_ADMIN')")
public class AppraisalGroupController {

    private final AppraisalGroupService groupService;

    /**
     * Create a group owned by the caller
     */
    @PostMapping
    public ResponseEntity<GroupDTO> createGroup(@Valid @RequestBody GroupRequest request,
                                                @AuthenticationPrincipal AppraisalActor actor) {
        return ResponseEntity.status(HttpStatus.CREATED).body(groupService.createGroup(request, actor));
    }

    /**
     * Get the caller's groups
     */
    @GetMapping
    public ResponseEntity<List<GroupDTO>> listGroups(@AuthenticationPrincipal AppraisalActor actor) {
        return ResponseEntity.ok(groupService.listGroups(actor));
    }

    @GetMapping("/{id}")
    public ResponseEntity<GroupDTO> getGroup(@PathVariable Long id,
                                             @AuthenticationPrincipal AppraisalActor actor) {
        return ResponseEntity.ok(groupService.getGroup(id, actor));
    }

    @PutMapping("/{id}")
    public ResponseEntity<GroupDTO> updateGroup(@PathVariable Long id,
                                                @Valid @RequestBody GroupUpdateRequest request,
                                                @AuthenticationPrincipal AppraisalActor actor) {
        return ResponseEntity.ok(groupService.updateGroup(id, request, actor));
    }

    /**
     * Delete a group no campaign refers to
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteGroup(@PathVariable Long id,
                                            @AuthenticationPrincipal AppraisalActor actor) {
        groupService.deleteGroup(id, actor);
        return ResponseEntity.noContent().build();
    }

    /**
     * Get group members in the order they were added
     */
    @GetMapping("/{id}/members")
    public ResponseEntity<List<GroupMemberDTO>> listMembers(@PathVariable Long id,
                                                            @AuthenticationPrincipal AppraisalActor actor) {
        return ResponseEntity.ok(groupService.listMembers(id, actor));
    }

    @PostMapping("/{id}/members")
    public ResponseEntity<GroupMemberDTO> addMember(@PathVariable Long id,
                                                    @Valid @RequestBody AddMemberRequest request,
                                                    @AuthenticationPrincipal AppraisalActor actor) {
        var member = groupService.addMember(id, request.getUserId(), actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(member);
    }

    @DeleteMapping("/{id}/members/{userId}")
    public ResponseEntity<Void> removeMember(@PathVariable Long id,
                                             @PathVariable Long userId,
                                             @AuthenticationPrincipal AppraisalActor actor) {
        groupService.removeMember(id, userId, actor);
        return ResponseEntity.noContent().build();
    }
}
