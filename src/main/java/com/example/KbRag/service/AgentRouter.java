package com.example.KbRag.service;

import com.example.KbRag.config.WeatherProperties;
import com.example.KbRag.tools.ToolProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the agent for a message. A leading "@agent " mention switches agent for that turn,
 * "@weather Météo à Bruxelles ?" for example; anything else goes to the knowledge-base agent.
 *
 * Unknown mentions are left in the message untouched.
 */
@Component
public class AgentRouter {

    private static final Logger log = LoggerFactory.getLogger(AgentRouter.class);

    public static final String DEFAULT_AGENT = "rag";
    public static final String WEATHER_AGENT = "weather";

    /** ASCII id only, so a mention can never carry anything but a registry key. */
    private static final Pattern MENTION = Pattern.compile("^@([a-zA-Z0-9_]{1,50})\\s+(.*)", Pattern.DOTALL);

    static final String DEFAULT_WEATHER_PROMPT = """
            Tu es un assistant météo spécialisé. Utilise l'outil getWeather pour toute question météo,
            réponds de façon concise et mentionne la source (Open-Meteo).
            Tu ne réponds qu'aux questions météo; pour le reste, suggère d'utiliser @rag.""";

    /**
     * @param toolProfile  forced tool profile, null to keep the one the request asked for
     * @param systemPrompt replacement system prompt, null to keep the chat client's default
     */
    public record Agent(String id, ToolProfile toolProfile, String systemPrompt, List<String> aliases) {
    }

    /**
     * @param question message with the mention removed
     */
    public record Route(Agent agent, String question) {
    }

    private final Agent defaultAgent = new Agent(DEFAULT_AGENT, null, null, List.of("kb"));
    private final Map<String, Agent> agents = new HashMap<>();

    public AgentRouter(PromptLoader promptLoader, WeatherProperties weatherProperties) {
        register(defaultAgent);
        if (weatherProperties.isEnabled()) {
            String prompt = promptLoader.load(weatherProperties.getSystemPromptLocation(), DEFAULT_WEATHER_PROMPT);
            register(new Agent(WEATHER_AGENT, ToolProfile.WEATHER, prompt, List.of("meteo")));
        }
    }

    private void register(Agent agent) {
        agents.put(agent.id(), agent);
        agent.aliases().forEach(alias -> agents.put(alias, agent));
    }

    public Optional<Agent> find(String idOrAlias) {
        if (idOrAlias == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(agents.get(idOrAlias.toLowerCase(Locale.ROOT)));
    }

    public Route route(String message) {
        if (message == null) {
            return new Route(defaultAgent, null);
        }
        Matcher matcher = MENTION.matcher(message.strip());
        if (matcher.matches()) {
            String question = matcher.group(2).strip();
            Optional<Agent> mentioned = find(matcher.group(1));
            if (mentioned.isPresent() && !question.isEmpty()) {
                log.info("Message routed to agent '{}'", mentioned.get().id());
                return new Route(mentioned.get(), question);
            }
        }
        return new Route(defaultAgent, message);
    }
}
