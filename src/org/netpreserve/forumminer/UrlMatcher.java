package org.netpreserve.forumminer;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.apache.commons.lang3.StringUtils;
import org.netpreserve.forumminer.util.Url;

import java.util.*;
import java.util.function.Predicate;

/**
 * Host based URL rules used for the outbound allow-list.
 */
@JsonSubTypes({
        @JsonSubTypes.Type(value = UrlMatcher.Host.class),
        @JsonSubTypes.Type(value = UrlMatcher.Domain.class),
})
@JsonTypeInfo(use = JsonTypeInfo.Id.DEDUCTION)
public sealed interface UrlMatcher extends Predicate<Url> {
    record Host(String host) implements UrlMatcher {
        @Override
        public boolean test(Url url) {
            return host.equalsIgnoreCase(url.host());
        }
    }

    /**
     * Matches a host and all of its subdomains.
     */
    record Domain(String domain) implements UrlMatcher {
        @Override
        public boolean test(Url url) {
            String host = url.host();
            if (host == null) return false;
            return domain.equalsIgnoreCase(host) || StringUtils.endsWithIgnoreCase(host, "." + domain);
        }
    }

    /**
     * A UrlMatcher that matches URLs against multiple other UrlMatchers.
     */
    final class Multi implements UrlMatcher {
        private final Set<String> hosts = new HashSet<>();
        private final NavigableSet<String> reversedDomainPrefixes = new TreeSet<>();

        public Multi() {
        }

        public Multi(Collection<UrlMatcher> matchers) {
            addAll(matchers);
        }

        public void addAll(Collection<UrlMatcher> matchers) {
            for (var matcher : matchers) {
                add(matcher);
            }
        }

        public void add(UrlMatcher matcher) {
            if (matcher instanceof Host host) {
                hosts.add(host.host().toLowerCase(Locale.ROOT));
            } else if (matcher instanceof Domain domain) {
                String lowerCaseDomain = domain.domain().toLowerCase(Locale.ROOT);
                hosts.add(lowerCaseDomain);
                reversedDomainPrefixes.add(Url.reverseHost(lowerCaseDomain));
            } else if (matcher instanceof Multi multi) {
                hosts.addAll(multi.hosts);
                reversedDomainPrefixes.addAll(multi.reversedDomainPrefixes);
            }
        }

        public boolean isEmpty() {
            return hosts.isEmpty();
        }

        @Override
        public boolean test(Url url) {
            if (!url.isHttp()) return false;
            String host = url.host();
            if (host == null) return false;
            if (hosts.contains(host)) return true;
            return !reversedDomainPrefixes.isEmpty() &&
                   containsPrefixOf(reversedDomainPrefixes, Url.reverseHost(host));
        }

        /**
         * Returns true if the set contains a string that is a prefix of the given string.
         */
        public static boolean containsPrefixOf(NavigableSet<String> set, String s) {
            String candidate = set.floor(s);
            while (candidate != null) {
                if (s.startsWith(candidate)) {
                    return true;
                }
                candidate = set.lower(candidate);
            }
            return false;
        }

        @Override
        public String toString() {
            return "Multi{hosts=" + hosts + ", domains=" + reversedDomainPrefixes + "}";
        }
    }
}
