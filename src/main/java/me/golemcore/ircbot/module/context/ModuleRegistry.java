package me.golemcore.ircbot.module.context;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.ircbot.domain.model.IrcBotException;
import me.golemcore.ircbot.domain.model.ModuleLoadMode;
import me.golemcore.ircbot.domain.model.TriggerPriority;
import me.golemcore.ircbot.domain.service.CommandArgParser;
import me.golemcore.ircbot.module.api.Module;
import me.golemcore.ircbot.module.api.ModuleFeature;
import me.golemcore.ircbot.module.api.ModuleLoadHandler;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns loaded modules, their commands and their triggers.
 *
 * <p>
 * Reads take the read lock and return immutable snapshots, so a dispatch
 * worker keeps using the entries it looked up even if a reload happens while
 * it runs. Loads take the write lock; on-load callbacks run after it is
 * released and may call back into the registry.
 *
 * <p>
 * A load first checks the module name and every feature against the load
 * mode and registers nothing if anything clashes. On-load callbacks run after
 * registration; when one fails the remaining callbacks are skipped and the
 * features stay registered.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ModuleRegistry {

    private final CommandArgParser argParser;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Module> modules = new TreeMap<>();
    private final Map<String, BotCommand> commands = new TreeMap<>();
    private final Map<TriggerPriority, List<Trigger>> triggers = new EnumMap<>(TriggerPriority.class);

    /**
     * Loads every module, collecting the errors of all of them.
     *
     * @return all errors, empty when every module loaded
     */
    public List<IrcBotException> loadModules(Collection<Module> toLoad, ModuleLoadMode mode) {
        List<IrcBotException> errors = new ArrayList<>();
        for (Module module : toLoad) {
            errors.addAll(load(module, mode));
        }
        if (!errors.isEmpty()) {
            log.warn("[Registry] {} error(s) while loading {} module(s)", errors.size(), toLoad.size());
        }
        return errors;
    }

    /**
     * Loads one module.
     *
     * @return the errors that stopped the load, empty on success
     */
    public List<IrcBotException> load(Module module, ModuleLoadMode mode) {
        List<IrcBotException> errors;
        lock.writeLock().lock();
        try {
            errors = register(module, mode);
        } finally {
            lock.writeLock().unlock();
        }
        if (!errors.isEmpty()) {
            for (IrcBotException error : errors) {
                log.warn("[Registry] Rejected module {}: {}", module.getName(), error.getMessage());
            }
            return errors;
        }

        for (ModuleLoadHandler handler : module.getLoadHandlers()) {
            try {
                handler.onLoad(this);
            } catch (Exception e) { // NOSONAR - a failing callback must not abort the caller
                log.warn("[Registry] On-load handler of module {} failed", module.getName(), e);
                return List.of(IrcBotException.moduleLoadFailed(module.getName(), e));
            }
        }
        log.info("[Registry] Loaded module {} ({} feature(s), mode {})", module.getName(),
                module.getFeatures().size(), mode);
        return List.of();
    }

    public Optional<BotCommand> command(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(commands.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> commandNames() {
        lock.readLock().lock();
        try {
            return List.copyOf(commands.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Module> module(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(modules.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> moduleNames() {
        lock.readLock().lock();
        try {
            return List.copyOf(modules.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Trigger> trigger(String name) {
        lock.readLock().lock();
        try {
            return findTrigger(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Snapshot of the trigger buckets, highest priority first. Empty buckets
     * are included.
     */
    public List<List<Trigger>> triggersByDescendingPriority() {
        lock.readLock().lock();
        try {
            List<List<Trigger>> buckets = new ArrayList<>();
            for (TriggerPriority priority : TriggerPriority.descending()) {
                buckets.add(List.copyOf(triggers.getOrDefault(priority, List.of())));
            }
            return buckets;
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<IrcBotException> register(Module module, ModuleLoadMode mode) {
        Module existingModule = modules.get(module.getName());
        if (existingModule != null && mode == ModuleLoadMode.ADD) {
            return List.of(IrcBotException.moduleRegistryClash(existingModule.toString(), module.getName()));
        }

        List<IrcBotException> errors = new ArrayList<>();
        Map<String, JsonNode> schemas = new HashMap<>();
        for (ModuleFeature feature : module.getFeatures()) {
            checkFeatureClash(module, feature, mode).ifPresent(errors::add);
            if (feature instanceof ModuleFeature.CommandFeature command) {
                try {
                    schemas.put(command.name(), argParser.parseUsage(command.usage()));
                } catch (IllegalArgumentException e) {
                    errors.add(IrcBotException.invalidFeature(module.getName(), command.name(), e.getMessage()));
                }
            }
        }
        if (!errors.isEmpty()) {
            return errors;
        }

        modules.put(module.getName(), module);
        for (ModuleFeature feature : module.getFeatures()) {
            if (feature instanceof ModuleFeature.CommandFeature command) {
                commands.put(command.name(), new BotCommand(command.name(), module, command.authLevel(),
                        command.handler(), command.usage(), schemas.get(command.name()), command.help()));
            } else if (feature instanceof ModuleFeature.TriggerFeature trigger) {
                findTrigger(trigger.name()).ifPresent(old -> triggers.get(old.priority()).remove(old));
                triggers.computeIfAbsent(trigger.priority(), p -> new ArrayList<>())
                        .add(new Trigger(trigger.name(), module, trigger.pattern(), trigger.priority(),
                                trigger.handler(), trigger.help(), trigger.id()));
            }
        }
        return List.of();
    }

    private Optional<IrcBotException> checkFeatureClash(Module module, ModuleFeature feature, ModuleLoadMode mode) {
        Module existingProvider = null;
        if (feature instanceof ModuleFeature.CommandFeature) {
            BotCommand existing = commands.get(feature.name());
            existingProvider = existing != null ? existing.provider() : null;
        } else if (feature instanceof ModuleFeature.TriggerFeature) {
            existingProvider = findTrigger(feature.name()).map(Trigger::provider).orElse(null);
        }
        if (existingProvider == null || mode == ModuleLoadMode.FORCE) {
            return Optional.empty();
        }
        if (mode == ModuleLoadMode.REPLACE && existingProvider.getName().equals(module.getName())) {
            return Optional.empty();
        }
        return Optional.of(IrcBotException.featureRegistryClash(feature.kind().label(), feature.name(),
                existingProvider.getName(), module.getName()));
    }

    private Optional<Trigger> findTrigger(String name) {
        for (List<Trigger> bucket : triggers.values()) {
            for (Trigger trigger : bucket) {
                if (trigger.name().equals(name)) {
                    return Optional.of(trigger);
                }
            }
        }
        return Optional.empty();
    }
}
