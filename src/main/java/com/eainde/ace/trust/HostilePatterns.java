package com.eainde.ace.trust;

import java.util.List;

/**
 * Default prompt-injection signatures, grouped by family.
 */
public final class HostilePatterns {

    public static final List<HostilePattern> DEFAULT = List.of(
            // instruction override
            HostilePattern.of("ignore_instructions", "ignore\\s+(all\\s+)?(previous|prior|above)\\s+(instructions?|prompts?|rules?)"),
            HostilePattern.of("disregard_instructions", "disregard\\s+(\\w+\\s+)*(previous|prior|above)"),
            HostilePattern.of("forget_instructions", "forget\\s+(everything|all|your)\\s+(previous|prior|above|you|that)"),
            HostilePattern.of("new_instructions", "new\\s+instructions?\\s*:"),
            // role override
            HostilePattern.of("role_override", "you\\s+are\\s+now\\s+(a|an)\\s+"),
            HostilePattern.of("from_now_on", "from\\s+now\\s+on,?\\s+you\\s+(are|will|must)"),
            HostilePattern.of("pretend_role", "pretend\\s+(to\\s+be|you\\s+are|you're)"),
            HostilePattern.of("act_as_role", "\\bact\\s+as\\s+(if\\s+you('re|\\s+are)|a|an)\\s+"),
            // system tag injection
            HostilePattern.of("system_override", "system\\s*:?\\s*(prompt|override|command)"),
            HostilePattern.of("system_tag", "</?system>"),
            HostilePattern.of("system_bracket", "\\[system\\]"),
            HostilePattern.of("system_marker", "<<\\s*system\\s*>>"),
            HostilePattern.of("role_injection", "\\]\\s*\\n\\s*\\[?(system|assistant|user)\\]?:"),
            HostilePattern.of("turn_injection", "^\\s*(human|assistant)\\s*:\\s*$"),
            // jailbreak
            HostilePattern.of("developer_mode", "developer\\s+mode"),
            HostilePattern.of("jailbreak", "jailbreak"),
            HostilePattern.of("dan_mode", "\\bDAN\\s+mode"),
            // authority manipulation
            HostilePattern.of("creator_impersonation", "I\\s+am\\s+(your|the)\\s+(creator|developer|admin)"),
            HostilePattern.of("vendor_impersonation", "anthropic\\s+(employee|staff|team|support)"),
            HostilePattern.of("admin_impersonation", "admin(istrator)?\\s+(here|speaking)"),
            HostilePattern.of("urgency_manipulation", "this\\s+is\\s+(an?\\s+)?(urgent|emergency|critical)"),
            // code smuggling
            HostilePattern.of("encoded_payload", "base64\\s*[:=]"),
            HostilePattern.of("eval_call", "\\beval\\s*\\("),
            HostilePattern.of("execute_code", "execute\\s+this\\s+code"),
            // destructive commands
            HostilePattern.of("destructive_command", "\\brm\\s+-rf\\b"),
            HostilePattern.of("mass_delete", "delete\\s+all\\s+(emails?|files?|data|messages?)"),
            HostilePattern.of("sudo_command", "\\bsudo\\s+"),
            // exfiltration
            HostilePattern.of("data_exfil", "send\\s+(all|my|the|your)\\s+(data|info|secrets?|keys?|tokens?|passwords?)"),
            HostilePattern.of("forward_attempt", "forward\\s+(this|all|everything)\\s+to")
    );

    private HostilePatterns() {
    }
}
